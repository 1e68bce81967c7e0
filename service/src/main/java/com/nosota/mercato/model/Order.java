package com.nosota.mercato.model;

import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
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
 * Buyer-facing order, split into one {@link SellerSubOrder} per store.
 *
 * <p>The order status is derived from the sub-order statuses (see
 * {@link com.nosota.mercato.service.OrderStatusRollup}) and is only set directly
 * at creation. {@code refundedAmount} is a running total over all its sub-orders.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Order {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Buyer-facing order number, e.g. ORD-20240115-0001.
     */
    @Column(name = "order_number", nullable = false, unique = true, length = 50)
    private String orderNumber;

    @Column(name = "buyer_id")
    private Long buyerId;

    /**
     * Derived status. Recomputed every time a sub-order changes.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    /**
     * Provider reference of the captured payment.
     * Passed back to the provider when refunding.
     */
    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    /**
     * Running total of refunds over all sub-orders.
     */
    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    /**
     * Placement time. Defines settlement period membership.
     */
    @Column(name = "ordered_at", nullable = false)
    private LocalDateTime orderedAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void addRefundedAmount(BigDecimal amount) {
        this.refundedAmount = this.refundedAmount.add(amount);
        this.updatedAt = LocalDateTime.now();
    }

    public void markPaymentCompleted(String paymentReference) {
        this.paymentStatus = PaymentStatus.COMPLETED;
        this.paymentReference = paymentReference;
        this.paidAt = LocalDateTime.now();
        this.updatedAt = this.paidAt;
    }
}
