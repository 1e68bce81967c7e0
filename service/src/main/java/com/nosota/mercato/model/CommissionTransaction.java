package com.nosota.mercato.model;

import com.nosota.mercato.api.model.CommissionSource;
import com.nosota.mercato.api.model.CommissionTransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.GenericGenerator;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Immutable audit record of a commission calculation.
 *
 * <p>INITIAL records are written when the escrow is created; REFUND_ADJUSTMENT records carry
 * a negative {@code commissionAmount}. Records are never updated or deleted, and the invoice
 * engine bills them by {@code createdAt}.
 */
@Entity
@Immutable
@Table(name = "commission_transaction")
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = lombok.AccessLevel.PROTECTED)
public class CommissionTransaction {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "escrow_transaction_id", nullable = false, updatable = false)
    private UUID escrowTransactionId;

    @Column(name = "store_id", nullable = false, updatable = false)
    private Long storeId;

    /**
     * Category whose override was applied, null otherwise.
     */
    @Column(name = "category_id", updatable = false)
    private Long categoryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 30)
    private CommissionTransactionType transactionType;

    @Column(name = "gross_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal grossAmount;

    @Column(name = "commission_percentage", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal commissionPercentage;

    @Column(name = "fixed_commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal fixedCommissionAmount;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "commission_source", nullable = false, updatable = false, length = 20)
    private CommissionSource commissionSource;

    @Column(name = "notes", updatable = false, length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
