package com.nosota.mercato.service;

import com.nosota.mercato.api.dto.OrderStatusHistoryDTO;
import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
import com.nosota.mercato.dto.OrderStatusHistoryMapper;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.OrderStatusHistory;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.OrderStatusHistoryRepository;
import com.nosota.mercato.repository.SellerSubOrderRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Service for the sub-order fulfillment lifecycle.
 *
 * <p>Every status change of a sub-order goes through this service:
 * <ul>
 *   <li>validated by {@link OrderStatusStateMachine}</li>
 *   <li>recorded as an {@link OrderStatusHistory} row in the same transaction</li>
 *   <li>followed by a recomputation of the parent order status ({@link OrderStatusRollup})</li>
 * </ul>
 *
 * <p>Lifecycle:
 * <pre>
 * 1. markOrderAsPaid      NEW → PAID for every sub-order
 * 2. markPreparing        PAID → PREPARING
 * 3. markShipped          PREPARING → SHIPPED (tracking stored)
 * 4. markDelivered        SHIPPED → DELIVERED
 * cancelSubOrder          NEW | PAID | PREPARING → CANCELLED
 * REFUNDED is reached only through {@link RefundService}
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderLifecycleService {

    private final OrderRepository orderRepository;
    private final SellerSubOrderRepository subOrderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final OrderStatusStateMachine stateMachine;

    /**
     * Records a completed payment and moves every NEW sub-order to PAID.
     *
     * <p>Calling it again for an already paid order has no effect.
     *
     * @param orderId          The order ID
     * @param paymentReference Provider reference of the captured payment
     * @throws ResourceNotFoundException if the order does not exist
     * @throws StateConflictException    if the payment was refunded or a sub-order cannot become PAID
     */
    @Transactional
    public void markOrderAsPaid(@NotNull UUID orderId, @NotNull String paymentReference) {
        // sub-orders are always locked before their order
        List<SellerSubOrder> subOrders = subOrderRepository.findByOrderIdForUpdate(orderId);
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

        if (order.getPaymentStatus() == PaymentStatus.COMPLETED) {
            log.info("Order {} is already paid, nothing to do", orderId);
            return;
        }
        if (order.getPaymentStatus() == PaymentStatus.REFUNDED) {
            throw new StateConflictException(String.format("Order %s has been refunded and cannot be paid", orderId));
        }

        order.markPaymentCompleted(paymentReference);

        for (SellerSubOrder subOrder : subOrders) {
            if (subOrder.getStatus() == OrderStatus.NEW) {
                applyTransition(subOrder, OrderStatus.PAID, "Payment completed", null);
            }
        }

        recalculateOrderStatus(order);
        log.info("Order {} marked as paid, payment reference {}", orderId, paymentReference);
    }

    /**
     * Moves a sub-order to a new status.
     *
     * @param subOrderId The sub-order ID
     * @param newStatus  Target status
     * @param notes      Optional note stored in the history
     * @param changedBy  User making the change, null for system changes
     * @return The updated sub-order
     * @throws ResourceNotFoundException if the sub-order does not exist
     * @throws StateConflictException    if the transition is not allowed, or the target is REFUNDED
     */
    @Transactional
    public SellerSubOrder transition(@NotNull UUID subOrderId, @NotNull OrderStatus newStatus,
                                     String notes, Long changedBy) {
        if (newStatus == OrderStatus.REFUNDED) {
            throw new StateConflictException(String.format(
                    "Sub-order %s cannot be moved to REFUNDED directly, refunds go through RefundService", subOrderId));
        }
        SellerSubOrder subOrder = lockSubOrder(subOrderId);
        if (applyTransition(subOrder, newStatus, notes, changedBy)) {
            recalculateOrderStatus(subOrder.getOrderId());
        }
        return subOrder;
    }

    @Transactional
    public SellerSubOrder markPreparing(@NotNull UUID subOrderId, Long changedBy) {
        return transition(subOrderId, OrderStatus.PREPARING, "Seller started preparing the order", changedBy);
    }

    /**
     * Marks a sub-order as shipped and stores its tracking information.
     *
     * @throws StateConflictException if the sub-order is not PREPARING
     */
    @Transactional
    public SellerSubOrder markShipped(@NotNull UUID subOrderId, String trackingNumber, String carrierName,
                                      String trackingUrl, Long changedBy) {
        SellerSubOrder subOrder = lockSubOrder(subOrderId);
        stateMachine.validateTransition(subOrder.getStatus(), OrderStatus.SHIPPED);

        subOrder.updateTracking(trackingNumber, carrierName, trackingUrl);
        String notes = trackingNumber != null
                ? String.format("Shipped with %s, tracking number %s", carrierName, trackingNumber)
                : "Shipped";
        if (applyTransition(subOrder, OrderStatus.SHIPPED, notes, changedBy)) {
            recalculateOrderStatus(subOrder.getOrderId());
        }
        return subOrder;
    }

    @Transactional
    public SellerSubOrder markDelivered(@NotNull UUID subOrderId, Long changedBy) {
        return transition(subOrderId, OrderStatus.DELIVERED, "Delivered to buyer", changedBy);
    }

    @Transactional
    public SellerSubOrder cancelSubOrder(@NotNull UUID subOrderId, String reason, Long changedBy) {
        String notes = reason != null ? "Cancelled: " + reason : "Cancelled";
        return transition(subOrderId, OrderStatus.CANCELLED, notes, changedBy);
    }

    /**
     * Replaces the tracking information of a shipped or delivered sub-order.
     * Writes a history row with unchanged status.
     *
     * @throws StateConflictException if the sub-order has not been shipped
     */
    @Transactional
    public SellerSubOrder updateTrackingInformation(@NotNull UUID subOrderId, String trackingNumber,
                                                    String carrierName, String trackingUrl, Long changedBy) {
        SellerSubOrder subOrder = lockSubOrder(subOrderId);
        if (subOrder.getStatus() != OrderStatus.SHIPPED && subOrder.getStatus() != OrderStatus.DELIVERED) {
            throw new StateConflictException(String.format(
                    "Tracking can only be updated for shipped or delivered sub-orders, sub-order %s is %s",
                    subOrderId, subOrder.getStatus()));
        }

        subOrder.updateTracking(trackingNumber, carrierName, trackingUrl);
        recordHistory(subOrder.getId(), subOrder.getStatus(), subOrder.getStatus(),
                String.format("Tracking updated: %s %s", carrierName, trackingNumber), changedBy);

        log.info("Updated tracking of sub-order {}: carrier={}, number={}", subOrderId, carrierName, trackingNumber);
        return subOrder;
    }

    public List<OrderStatusHistoryDTO> getStatusHistory(@NotNull UUID subOrderId) {
        if (!subOrderRepository.existsById(subOrderId)) {
            throw new ResourceNotFoundException("Sub-order", subOrderId);
        }
        return OrderStatusHistoryMapper.INSTANCE.toDTOList(
                historyRepository.findBySubOrderIdOrderByChangedAtAsc(subOrderId));
    }

    /**
     * Applies a transition to a sub-order the caller has already locked.
     * Does not touch the parent order; call {@link #recalculateOrderStatus(UUID)} afterwards.
     *
     * @return true if the status changed, false for a same-status no-op
     * @throws StateConflictException if the transition is not allowed
     */
    public boolean applyTransition(SellerSubOrder subOrder, OrderStatus newStatus, String notes, Long changedBy) {
        if (newStatus == null) {
            throw new InvalidRequestException("Target status is required");
        }
        OrderStatus previousStatus = subOrder.getStatus();
        if (previousStatus == newStatus) {
            return false;
        }

        stateMachine.validateTransition(previousStatus, newStatus);

        recordHistory(subOrder.getId(), previousStatus, newStatus, notes, changedBy);
        subOrder.changeStatus(newStatus);
        subOrderRepository.save(subOrder);

        log.info("Sub-order {} status changed: {} → {}", subOrder.getId(), previousStatus, newStatus);
        return true;
    }

    /**
     * Re-derives the parent order status from all of its sub-orders.
     *
     * @param orderId The order ID
     * @return The derived status
     */
    @Transactional
    public OrderStatus recalculateOrderStatus(@NotNull UUID orderId) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        return recalculateOrderStatus(order);
    }

    private OrderStatus recalculateOrderStatus(Order order) {
        List<OrderStatus> subOrderStatuses = subOrderRepository.findByOrderId(order.getId()).stream()
                .map(SellerSubOrder::getStatus)
                .toList();
        if (subOrderStatuses.isEmpty()) {
            log.warn("Order {} has no sub-orders, status left at {}", order.getId(), order.getStatus());
            return order.getStatus();
        }

        OrderStatus derived = OrderStatusRollup.deriveOrderStatus(subOrderStatuses);
        if (derived != order.getStatus()) {
            log.info("Order {} status changed: {} → {}", order.getId(), order.getStatus(), derived);
            order.setStatus(derived);
            order.setUpdatedAt(LocalDateTime.now());
            orderRepository.save(order);
        }
        return derived;
    }

    private SellerSubOrder lockSubOrder(UUID subOrderId) {
        return subOrderRepository.findByIdForUpdate(subOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("Sub-order", subOrderId));
    }

    private void recordHistory(UUID subOrderId, OrderStatus previousStatus, OrderStatus newStatus,
                               String notes, Long changedBy) {
        historyRepository.save(OrderStatusHistory.builder()
                .subOrderId(subOrderId)
                .previousStatus(previousStatus)
                .newStatus(newStatus)
                .notes(notes)
                .changedBy(changedBy)
                .changedAt(LocalDateTime.now())
                .build());
    }
}
