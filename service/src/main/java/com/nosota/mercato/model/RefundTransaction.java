package com.nosota.mercato.model;

import com.nosota.mercato.api.model.RefundInitiator;
import com.nosota.mercato.api.model.RefundStatus;
import com.nosota.mercato.api.model.RefundType;
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
 * Refund entity - one record per refund action, full or partial.
 *
 * <p>Refund workflow:
 * <pre>
 * 1. Eligibility checked under a sub-order row lock → REQUESTED
 * 2. Provider reversal call → PROCESSING
 * 3. Provider succeeded → balances, escrow and commission reversed → COMPLETED
 *    Provider failed   → FAILED (error message kept, retryable)
 * </pre>
 *
 * <p>The provider call and the balance reversal are tracked by two separate flags, so a
 * retry repeats only the step that has not happened yet.
 */
@Entity
@Table(name = "refund_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RefundTransaction {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * REF-{yyyyMMddHHmmss}-{4 digits}.
     */
    @Column(name = "refund_number", nullable = false, unique = true, length = 50)
    private String refundNumber;

    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    /**
     * Refunded sub-order. Null for a FULL refund, which covers every active sub-order.
     */
    @Column(name = "sub_order_id")
    private UUID subOrderId;

    @Column(name = "store_id")
    private Long storeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_type", nullable = false, length = 10)
    private RefundType refundType;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    /**
     * Commission returned to the seller, as a negative number. Zero until funds are reversed.
     */
    @Column(name = "commission_refund_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal commissionRefundAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RefundStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "initiator", nullable = false, length = 20)
    private RefundInitiator initiator;

    /**
     * User who initiated the refund, null for SYSTEM.
     */
    @Column(name = "initiated_by")
    private Long initiatedBy;

    @Column(name = "return_request_id")
    private UUID returnRequestId;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "notes", length = 1000)
    private String notes;

    /**
     * Sent to the provider on every attempt so a repeated call is not executed twice.
     */
    @Column(name = "idempotency_key", nullable = false, length = 100)
    private String idempotencyKey;

    @Column(name = "provider_refund_id", length = 100)
    private String providerRefundId;

    /**
     * Last provider error. Cleared when a retry starts.
     */
    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "attempt_count", nullable = false)
    private Integer attemptCount;

    /**
     * The provider confirmed the reversal.
     */
    @Column(name = "provider_succeeded", nullable = false)
    private boolean providerSucceeded;

    /**
     * Sub-order, order, escrow and commission totals have been updated.
     */
    @Column(name = "funds_reversed", nullable = false)
    private boolean fundsReversed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
