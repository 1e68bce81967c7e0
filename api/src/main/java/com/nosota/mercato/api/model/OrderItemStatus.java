package com.nosota.mercato.api.model;

/**
 * Fulfillment status of a single order line.
 */
public enum OrderItemStatus {
    /**
     * NEW: Nothing shipped or cancelled yet.
     */
    NEW,

    /**
     * PREPARING: Being packed, or partially shipped/cancelled.
     */
    PREPARING,

    /**
     * SHIPPED: Every non-cancelled unit has been shipped.
     */
    SHIPPED,

    /**
     * CANCELLED: Every unit has been cancelled.
     */
    CANCELLED
}
