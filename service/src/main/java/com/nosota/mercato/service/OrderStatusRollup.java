package com.nosota.mercato.service;

import com.nosota.mercato.api.model.OrderItemStatus;
import com.nosota.mercato.api.model.OrderStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Pure functions deriving a parent status from child statuses.
 *
 * <p>Order from sub-orders, first match wins:
 * <ol>
 *   <li>all DELIVERED → DELIVERED</li>
 *   <li>all CANCELLED → CANCELLED; all REFUNDED → REFUNDED</li>
 *   <li>most advanced non-terminal status: DELIVERED > SHIPPED > PREPARING > PAID > NEW</li>
 *   <li>only terminal statuses, mixed → CANCELLED</li>
 * </ol>
 *
 * <p>Sub-order from items: all CANCELLED → CANCELLED; any SHIPPED → SHIPPED;
 * any PREPARING → PREPARING; otherwise no change.
 */
public final class OrderStatusRollup {

    private static final List<OrderStatus> ACTIVE_PRECEDENCE = List.of(
            OrderStatus.DELIVERED,
            OrderStatus.SHIPPED,
            OrderStatus.PREPARING,
            OrderStatus.PAID,
            OrderStatus.NEW
    );

    private OrderStatusRollup() {
    }

    /**
     * Derives the order status from the statuses of its sub-orders.
     *
     * @param subOrderStatuses Statuses of all sub-orders, duplicates allowed
     * @return Derived order status
     * @throws IllegalArgumentException if the collection is empty
     */
    public static OrderStatus deriveOrderStatus(Collection<OrderStatus> subOrderStatuses) {
        if (subOrderStatuses == null || subOrderStatuses.isEmpty()) {
            throw new IllegalArgumentException("An order needs at least one sub-order to derive its status");
        }

        if (allEqual(subOrderStatuses, OrderStatus.DELIVERED)) {
            return OrderStatus.DELIVERED;
        }
        if (allEqual(subOrderStatuses, OrderStatus.CANCELLED)) {
            return OrderStatus.CANCELLED;
        }
        if (allEqual(subOrderStatuses, OrderStatus.REFUNDED)) {
            return OrderStatus.REFUNDED;
        }

        for (OrderStatus candidate : ACTIVE_PRECEDENCE) {
            if (subOrderStatuses.contains(candidate)) {
                return candidate;
            }
        }

        // only CANCELLED and REFUNDED left
        return OrderStatus.CANCELLED;
    }

    /**
     * Derives the sub-order status implied by its items.
     *
     * @param itemStatuses Statuses of all items of the sub-order
     * @return Implied status, empty when the items do not imply a change
     */
    public static Optional<OrderStatus> deriveSubOrderStatus(Collection<OrderItemStatus> itemStatuses) {
        if (itemStatuses == null || itemStatuses.isEmpty()) {
            return Optional.empty();
        }
        if (itemStatuses.stream().allMatch(s -> s == OrderItemStatus.CANCELLED)) {
            return Optional.of(OrderStatus.CANCELLED);
        }
        if (itemStatuses.contains(OrderItemStatus.SHIPPED)) {
            return Optional.of(OrderStatus.SHIPPED);
        }
        if (itemStatuses.contains(OrderItemStatus.PREPARING)) {
            return Optional.of(OrderStatus.PREPARING);
        }
        return Optional.empty();
    }

    private static boolean allEqual(Collection<OrderStatus> statuses, OrderStatus expected) {
        return statuses.stream().allMatch(s -> s == expected);
    }
}
