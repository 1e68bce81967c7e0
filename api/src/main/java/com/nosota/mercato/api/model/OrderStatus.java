package com.nosota.mercato.api.model;

/**
 * Fulfillment status of a seller sub-order and, derived from its sub-orders, of the parent order.
 *
 * <p>CANCELLED and REFUNDED are terminal.
 */
public enum OrderStatus {
    /**
     * NEW: Order placed, payment not yet confirmed.
     */
    NEW,

    /**
     * PAID: Payment completed, seller has not started preparing.
     */
    PAID,

    /**
     * PREPARING: Seller is packing the items.
     */
    PREPARING,

    /**
     * SHIPPED: Handed over to the carrier, tracking may be present.
     */
    SHIPPED,

    /**
     * DELIVERED: Buyer received the shipment.
     */
    DELIVERED,

    /**
     * CANCELLED: Cancelled before shipment. Final state.
     */
    CANCELLED,

    /**
     * REFUNDED: Whole amount returned to the buyer. Final state.
     */
    REFUNDED;

    public boolean isTerminal() {
        return this == CANCELLED || this == REFUNDED;
    }
}
