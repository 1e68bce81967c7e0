package com.nosota.mercato.error;

/**
 * Operation conflicts with the current state: invalid status transition, duplicate document
 * for a period, refund over the remaining balance, mutation of a finalized document.
 */
public class StateConflictException extends MarketplaceException {
    public StateConflictException(String message) {
        super(message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
