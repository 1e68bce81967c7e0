package com.nosota.mercato.api.model;

/**
 * Store lifecycle status.
 * Period close only runs for ACTIVE stores.
 */
public enum StoreStatus {
    PENDING_VERIFICATION,
    ACTIVE,
    SUSPENDED
}
