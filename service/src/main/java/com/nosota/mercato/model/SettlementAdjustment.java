package com.nosota.mercato.model;

import com.nosota.mercato.api.model.SettlementAdjustmentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Manual correction on a settlement. Copied forward to every regenerated version.
 */
@Entity
@Table(name = "settlement_adjustment")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SettlementAdjustment {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "settlement_id", nullable = false)
    private UUID settlementId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private SettlementAdjustmentType type;

    /**
     * Signed: positive credits the seller, negative debits.
     */
    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "description", nullable = false, length = 600)
    private String description;

    @Column(name = "related_settlement_id")
    private UUID relatedSettlementId;

    @Column(name = "prior_period_adjustment", nullable = false)
    private boolean priorPeriodAdjustment;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
