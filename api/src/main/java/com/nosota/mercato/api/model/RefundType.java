package com.nosota.mercato.api.model;

/**
 * Type of refund operation.
 */
public enum RefundType {
    /**
     * FULL: Refunds the remaining amount of every active sub-order of the order.
     */
    FULL,

    /**
     * PARTIAL: Refunds part of one sub-order.
     * Several partial refunds are allowed while the sum stays within the sub-order total.
     */
    PARTIAL
}
