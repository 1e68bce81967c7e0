package com.nosota.mercato.api.model;

/**
 * Refund initiator type.
 * Identifies who requested the refund operation.
 */
public enum RefundInitiator {
    /**
     * BUYER: Requested by the buyer, usually through a return request.
     */
    BUYER,

    /**
     * SELLER: Initiated by the store, e.g. when cancelling items it cannot ship.
     */
    SELLER,

    /**
     * ADMIN: Manual intervention by platform support for dispute resolution.
     */
    ADMIN,

    /**
     * SYSTEM: Automated refunds.
     */
    SYSTEM
}
