package com.nosota.mercato.model;

import com.nosota.mercato.api.model.OrderItemStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * A product line of a sub-order, with partial fulfillment counters.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code quantity == quantityShipped + quantityCancelled + available}, available ≥ 0</li>
 *   <li>{@code refundedAmount <= (unitPrice + taxAmount / quantity) * quantity}</li>
 * </ul>
 */
@Entity
@Table(name = "order_item")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class OrderItem {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "sub_order_id", nullable = false)
    private UUID subOrderId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    /**
     * Category at order time. Drives category commission overrides.
     */
    @Column(name = "category_id")
    private Long categoryId;

    /**
     * Product title at the time of order.
     */
    @Column(name = "product_title", nullable = false, length = 200)
    private String productTitle;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "quantity_shipped", nullable = false)
    private Integer quantityShipped;

    @Column(name = "quantity_cancelled", nullable = false)
    private Integer quantityCancelled;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    /**
     * Tax for the whole line, not per unit.
     */
    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderItemStatus status;

    public int getAvailableQuantity() {
        return quantity - quantityShipped - quantityCancelled;
    }

    /**
     * Unit price plus the per-unit share of the line tax, times the given quantity.
     */
    public BigDecimal refundAmountFor(int units) {
        BigDecimal taxPerUnit = quantity > 0
                ? taxAmount.divide(BigDecimal.valueOf(quantity), 10, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return unitPrice.add(taxPerUnit)
                .multiply(BigDecimal.valueOf(units))
                .setScale(2, RoundingMode.HALF_UP);
    }

    public void ship(int units) {
        this.quantityShipped += units;
        if (quantityShipped + quantityCancelled == quantity) {
            // nothing left to ship
            this.status = quantityShipped > 0 ? OrderItemStatus.SHIPPED : OrderItemStatus.CANCELLED;
        } else if (status == OrderItemStatus.NEW) {
            this.status = OrderItemStatus.PREPARING;
        }
    }

    public void cancel(int units, BigDecimal refund) {
        BigDecimal maxRefund = refundAmountFor(quantity);
        if (refundedAmount.add(refund).compareTo(maxRefund) > 0) {
            throw new IllegalStateException(String.format(
                    "Item %s refunded amount would exceed %s", id, maxRefund));
        }
        this.quantityCancelled += units;
        this.refundedAmount = refundedAmount.add(refund);
        if (quantityCancelled.equals(quantity)) {
            this.status = OrderItemStatus.CANCELLED;
        } else if (quantityShipped + quantityCancelled == quantity) {
            this.status = OrderItemStatus.SHIPPED;
        } else if (status == OrderItemStatus.NEW) {
            this.status = OrderItemStatus.PREPARING;
        }
    }
}
