package com.nosota.mercato.service;

import com.nosota.mercato.api.model.OrderItemStatus;
import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.OrderItem;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.repository.OrderItemRepository;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.SellerSubOrderRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Item-level (partial) fulfillment inside a sub-order.
 *
 * <p>Items can be prepared, shipped or cancelled unit by unit. After every change the
 * sub-order status is derived again from its items ({@link OrderStatusRollup#deriveSubOrderStatus})
 * and moved forward through {@link OrderLifecycleService}. Cancelled units are refunded to the
 * buyer through {@link RefundService}.
 *
 * <p>Fulfillment needs a COMPLETED payment and a sub-order that is not CANCELLED or REFUNDED.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderItemFulfillmentService {

    private final OrderItemRepository orderItemRepository;
    private final SellerSubOrderRepository subOrderRepository;
    private final OrderRepository orderRepository;
    private final OrderLifecycleService orderLifecycleService;
    private final RefundService refundService;

    @Transactional
    public OrderItem markItemPreparing(@NotNull UUID orderItemId, Long userId) {
        OrderItem item = findItem(orderItemId);
        if (item.getStatus() != OrderItemStatus.NEW) {
            throw new StateConflictException(String.format(
                    "Cannot change item %s from %s to PREPARING, item must be NEW", orderItemId, item.getStatus()));
        }
        SellerSubOrder subOrder = validateItemFulfillment(item.getSubOrderId());

        item.setStatus(OrderItemStatus.PREPARING);
        orderItemRepository.save(item);
        updateSubOrderStatusFromItems(subOrder, userId);

        log.info("Marked order item {} as preparing by user {}", orderItemId, userId);
        return item;
    }

    /**
     * Ships some units of an item.
     *
     * @throws InvalidRequestException if the quantity is not positive
     * @throws StateConflictException  if fewer units are available or fulfillment is blocked
     */
    @Transactional
    public OrderItem shipItemQuantity(@NotNull UUID orderItemId, int quantity, Long userId) {
        OrderItem item = findItem(orderItemId);
        checkQuantity(item, quantity, "ship");
        SellerSubOrder subOrder = validateItemFulfillment(item.getSubOrderId());

        item.ship(quantity);
        orderItemRepository.save(item);
        updateSubOrderStatusFromItems(subOrder, userId);

        log.info("Shipped {} unit(s) of order item {} by user {}", quantity, orderItemId, userId);
        return item;
    }

    /**
     * Cancels some units of an item and refunds their value, tax included, to the buyer.
     *
     * @return Amount refunded for the cancelled units
     * @throws InvalidRequestException if the quantity is not positive
     * @throws StateConflictException  if fewer units are available or fulfillment is blocked
     */
    @Transactional
    public BigDecimal cancelItemQuantity(@NotNull UUID orderItemId, int quantity, String reason, Long userId) {
        OrderItem item = findItem(orderItemId);
        checkQuantity(item, quantity, "cancel");
        SellerSubOrder subOrder = validateItemFulfillment(item.getSubOrderId());

        BigDecimal refundAmount = item.refundAmountFor(quantity);
        item.cancel(quantity, refundAmount);
        orderItemRepository.save(item);

        if (refundAmount.signum() > 0) {
            String refundReason = String.format("Cancelled %d x %s%s", quantity, item.getProductTitle(),
                    reason != null ? ": " + reason : "");
            refundService.refundCancelledItems(subOrder.getId(), refundAmount, refundReason, userId);
        }
        updateSubOrderStatusFromItems(subOrder, userId);

        log.info("Cancelled {} unit(s) of order item {} with refund {} by user {}",
                quantity, orderItemId, refundAmount, userId);
        return refundAmount;
    }

    public int getAvailableQuantity(@NotNull UUID orderItemId) {
        return findItem(orderItemId).getAvailableQuantity();
    }

    /**
     * Refund owed for cancelling units of an item: {@code (unitPrice + taxAmount / quantity) * units}.
     */
    public BigDecimal calculateItemRefundAmount(@NotNull UUID orderItemId, int quantityToCancel) {
        return findItem(orderItemId).refundAmountFor(quantityToCancel);
    }

    public List<OrderItem> getSubOrderItems(@NotNull UUID subOrderId) {
        return orderItemRepository.findBySubOrderIdOrderByIdAsc(subOrderId);
    }

    /**
     * Locks the sub-order and checks that its items may be fulfilled.
     *
     * @return The locked sub-order
     * @throws StateConflictException if the payment is not completed or the sub-order is terminal
     */
    @Transactional
    public SellerSubOrder validateItemFulfillment(@NotNull UUID subOrderId) {
        SellerSubOrder subOrder = subOrderRepository.findByIdForUpdate(subOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("Sub-order", subOrderId));
        Order order = orderRepository.findById(subOrder.getOrderId())
                .orElseThrow(() -> new ResourceNotFoundException("Order", subOrder.getOrderId()));

        if (order.getPaymentStatus() != PaymentStatus.COMPLETED) {
            throw new StateConflictException("Cannot fulfill items until payment is completed");
        }
        if (subOrder.getStatus().isTerminal()) {
            throw new StateConflictException(String.format(
                    "Cannot fulfill items for sub-order in %s status", subOrder.getStatus()));
        }
        return subOrder;
    }

    private void updateSubOrderStatusFromItems(SellerSubOrder subOrder, Long userId) {
        List<OrderItemStatus> itemStatuses = orderItemRepository.findBySubOrderIdOrderByIdAsc(subOrder.getId()).stream()
                .map(OrderItem::getStatus)
                .toList();
        Optional<OrderStatus> implied = OrderStatusRollup.deriveSubOrderStatus(itemStatuses);
        if (implied.isEmpty()) {
            return;
        }

        OrderStatus current = subOrder.getStatus();
        OrderStatus target = implied.get();
        boolean changed = false;

        if (current.isTerminal() || current == target) {
            return;
        }
        if (target == OrderStatus.CANCELLED) {
            changed = orderLifecycleService.applyTransition(subOrder, OrderStatus.CANCELLED,
                    "All items cancelled", userId);
        } else if (target.ordinal() > current.ordinal()) {
            // fulfillment only moves forward, PAID reaches SHIPPED through PREPARING
            if (current == OrderStatus.PAID && target == OrderStatus.SHIPPED) {
                orderLifecycleService.applyTransition(subOrder, OrderStatus.PREPARING, "Items being prepared", userId);
            }
            changed = orderLifecycleService.applyTransition(subOrder, target,
                    target == OrderStatus.SHIPPED ? "Items shipped" : "Items being prepared", userId);
        }

        if (changed) {
            orderLifecycleService.recalculateOrderStatus(subOrder.getOrderId());
        }
    }

    private void checkQuantity(OrderItem item, int quantity, String action) {
        if (quantity <= 0) {
            throw new InvalidRequestException(String.format("Quantity to %s must be greater than 0", action));
        }
        int available = item.getAvailableQuantity();
        if (quantity > available) {
            throw new StateConflictException(String.format(
                    "Cannot %s %d unit(s) of item %s, only %d available", action, quantity, item.getId(), available));
        }
    }

    private OrderItem findItem(UUID orderItemId) {
        return orderItemRepository.findById(orderItemId)
                .orElseThrow(() -> new ResourceNotFoundException("Order item", orderItemId));
    }
}
