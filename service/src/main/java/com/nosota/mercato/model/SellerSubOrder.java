package com.nosota.mercato.model;

import com.nosota.mercato.api.model.OrderStatus;
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
 * The part of an order that one store fulfills.
 *
 * <p>Status changes only through {@link com.nosota.mercato.service.OrderLifecycleService}.
 * Invariant: {@code 0 <= refundedAmount <= totalAmount}, and refundedAmount never decreases.
 */
@Entity
@Table(name = "seller_sub_order")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SellerSubOrder {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    @Column(name = "store_id", nullable = false)
    private Long storeId;

    @Column(name = "sub_order_number", nullable = false, length = 60)
    private String subOrderNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    /**
     * Items, tax and shipping of this store.
     */
    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "tracking_number", length = 100)
    private String trackingNumber;

    @Column(name = "carrier_name", length = 100)
    private String carrierName;

    @Column(name = "tracking_url", length = 500)
    private String trackingUrl;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public BigDecimal getRemainingRefundableAmount() {
        return totalAmount.subtract(refundedAmount);
    }

    public boolean isFullyRefunded() {
        return refundedAmount.compareTo(totalAmount) >= 0;
    }

    /**
     * Adds a refund to the running total.
     *
     * @throws IllegalStateException if the total would exceed the sub-order amount
     */
    public void addRefundedAmount(BigDecimal amount) {
        BigDecimal updated = refundedAmount.add(amount);
        if (amount.signum() <= 0 || updated.compareTo(totalAmount) > 0) {
            throw new IllegalStateException(String.format(
                    "Refund %s would move sub-order %s refunded amount outside [0, %s]", amount, id, totalAmount));
        }
        this.refundedAmount = updated;
        this.updatedAt = LocalDateTime.now();
    }

    public void changeStatus(OrderStatus newStatus) {
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
    }

    public void updateTracking(String trackingNumber, String carrierName, String trackingUrl) {
        this.trackingNumber = trackingNumber;
        this.carrierName = carrierName;
        this.trackingUrl = trackingUrl;
        this.updatedAt = LocalDateTime.now();
    }
}
