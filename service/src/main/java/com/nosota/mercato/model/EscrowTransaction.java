package com.nosota.mercato.model;

import com.nosota.mercato.api.model.EscrowStatus;
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
 * Funds the platform holds for one sub-order until payout.
 *
 * <p>Amounts only accumulate:
 * <pre>
 * refundedAmount   += refund
 * commissionAmount += adjustment          (adjustment is negative)
 * netAmount         = gross - refunded - commission
 * </pre>
 */
@Entity
@Table(name = "escrow_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class EscrowTransaction {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "sub_order_id", nullable = false, unique = true)
    private UUID subOrderId;

    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    @Column(name = "store_id", nullable = false)
    private Long storeId;

    @Column(name = "gross_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal grossAmount;

    /**
     * Commission charged at creation. Never changes; refund reversals are proportional to it.
     */
    @Column(name = "original_commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal originalCommissionAmount;

    /**
     * Commission after refund adjustments.
     */
    @Column(name = "commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "net_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private EscrowStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "released_at")
    private LocalDateTime releasedAt;

    @Column(name = "returned_to_buyer_at")
    private LocalDateTime returnedToBuyerAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Books a refund and the matching (negative) commission adjustment.
     */
    public void applyRefund(BigDecimal refundAmount, BigDecimal commissionAdjustment) {
        this.refundedAmount = refundedAmount.add(refundAmount);
        this.commissionAmount = commissionAmount.add(commissionAdjustment);
        this.netAmount = grossAmount.subtract(refundedAmount).subtract(commissionAmount);
        this.updatedAt = LocalDateTime.now();
        if (refundedAmount.compareTo(grossAmount) >= 0) {
            this.status = EscrowStatus.RETURNED_TO_BUYER;
            this.returnedToBuyerAt = updatedAt;
        } else {
            this.status = EscrowStatus.PARTIALLY_REFUNDED;
        }
    }

    public void release() {
        this.status = EscrowStatus.RELEASED;
        this.releasedAt = LocalDateTime.now();
        this.updatedAt = releasedAt;
    }

    public boolean isRefundable() {
        return status == EscrowStatus.HELD || status == EscrowStatus.PARTIALLY_REFUNDED;
    }
}
