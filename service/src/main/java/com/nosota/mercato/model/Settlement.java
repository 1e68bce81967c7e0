package com.nosota.mercato.model;

import com.nosota.mercato.api.model.SettlementStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Settlement entity - versioned financial snapshot of one store for one period.
 *
 * <p>Versioning:
 * <pre>
 * v1 (DRAFT, current) --regenerate--> v1 (SUPERSEDED) + v2 (DRAFT, current, previous = v1)
 * vN (DRAFT) --finalize--> vN (FINALIZED), immutable from then on
 * </pre>
 *
 * <p>Exactly one version per (store, period) has {@code currentVersion = true}.
 */
@Entity
@Table(name = "settlement")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Settlement {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * STL-{storeId:000000}-{yyyyMM}. Shared by all versions of a period.
     */
    @Column(name = "settlement_number", nullable = false, length = 50)
    private String settlementNumber;

    @Column(name = "store_id", nullable = false)
    private Long storeId;

    @Column(name = "period_start", nullable = false)
    private LocalDateTime periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDateTime periodEnd;

    @Column(name = "gross_sales", nullable = false, precision = 19, scale = 2)
    private BigDecimal grossSales;

    @Column(name = "refunds", nullable = false, precision = 19, scale = 2)
    private BigDecimal refunds;

    @Column(name = "total_commission", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCommission;

    @Column(name = "total_adjustments", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAdjustments;

    @Column(name = "net_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    /**
     * Payouts completed within the period. Informational, not part of netAmount.
     */
    @Column(name = "total_payouts", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPayouts;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "current_version", nullable = false)
    private boolean currentVersion;

    @Column(name = "previous_settlement_id")
    private UUID previousSettlementId;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "finalized_at")
    private LocalDateTime finalizedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isFinalized() {
        return status == SettlementStatus.FINALIZED;
    }

    public void addAdjustment(BigDecimal amount) {
        this.totalAdjustments = totalAdjustments.add(amount);
        recalculateNetAmount();
    }

    public void recalculateNetAmount() {
        this.netAmount = grossSales.subtract(refunds).subtract(totalCommission).add(totalAdjustments);
        this.updatedAt = LocalDateTime.now();
    }

    public void supersede() {
        this.status = SettlementStatus.SUPERSEDED;
        this.currentVersion = false;
        this.updatedAt = LocalDateTime.now();
    }

    public void finalizeSettlement() {
        this.status = SettlementStatus.FINALIZED;
        this.finalizedAt = LocalDateTime.now();
        this.updatedAt = finalizedAt;
    }
}
