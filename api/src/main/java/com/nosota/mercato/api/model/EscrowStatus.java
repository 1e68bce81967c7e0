package com.nosota.mercato.api.model;

/**
 * Status of the funds the platform holds for a sub-order.
 */
public enum EscrowStatus {
    /**
     * HELD: Funds are held pending delivery.
     */
    HELD,

    /**
     * PARTIALLY_REFUNDED: Part of the gross amount went back to the buyer.
     */
    PARTIALLY_REFUNDED,

    /**
     * RETURNED_TO_BUYER: The whole gross amount was refunded. Final state.
     */
    RETURNED_TO_BUYER,

    /**
     * RELEASED: Released to the seller after delivery. No further refunds. Final state.
     */
    RELEASED
}
