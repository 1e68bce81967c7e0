package com.nosota.mercato.api.model;

/**
 * Payment status of an order as reported by the payment provider.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    /**
     * REFUNDED: The whole order was refunded.
     * Partial refunds leave the payment COMPLETED.
     */
    REFUNDED
}
