package com.nosota.mercato.service;

import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.error.StateConflictException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating sub-order {@link OrderStatus} transitions.
 *
 * <p>Implements strict validation rules for the fulfillment lifecycle:
 * <ul>
 *   <li>NEW is the initial state (order placed, not paid)</li>
 *   <li>Same-status transitions are no-ops and always allowed</li>
 *   <li>CANCELLED and REFUNDED are final states</li>
 * </ul>
 *
 * <p>State diagram:
 * <pre>
 *   NEW ──► PAID ──► PREPARING ──► SHIPPED ──► DELIVERED
 *    │       │  │        │            │            │
 *    ▼       ▼  │        ▼            ▼            ▼
 * CANCELLED ◄───┘    CANCELLED     REFUNDED ◄── REFUNDED
 *            (PAID ──► CANCELLED | REFUNDED)
 * </pre>
 */
@Component
public class OrderStatusStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<OrderStatus, Set<OrderStatus>> ALLOWED_TRANSITIONS = Map.of(
            OrderStatus.NEW, EnumSet.of(OrderStatus.PAID, OrderStatus.CANCELLED),
            OrderStatus.PAID, EnumSet.of(OrderStatus.PREPARING, OrderStatus.CANCELLED, OrderStatus.REFUNDED),
            OrderStatus.PREPARING, EnumSet.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED),
            OrderStatus.SHIPPED, EnumSet.of(OrderStatus.DELIVERED, OrderStatus.REFUNDED),
            OrderStatus.DELIVERED, EnumSet.of(OrderStatus.REFUNDED)
            // CANCELLED and REFUNDED are final states - no transitions allowed
    );

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(OrderStatus fromStatus, OrderStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        // Same status is always allowed (no-op)
        if (fromStatus == toStatus) {
            return true;
        }

        Set<OrderStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws StateConflictException if transition is not allowed
     */
    public void validateTransition(OrderStatus fromStatus, OrderStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new StateConflictException(
                    String.format("Invalid order status transition: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            getAllowedTransitions(fromStatus))
            );
        }
    }

    /**
     * Checks if a status is a final state (no further transitions allowed).
     *
     * @param status Status to check
     * @return true if status is final
     */
    public boolean isFinalState(OrderStatus status) {
        return status != null && status.isTerminal();
    }

    /**
     * Gets all allowed target statuses from a given status.
     *
     * @param fromStatus Current status
     * @return Set of allowed target statuses (empty if none allowed)
     */
    public Set<OrderStatus> getAllowedTransitions(OrderStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
