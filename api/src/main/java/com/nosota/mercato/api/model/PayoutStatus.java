package com.nosota.mercato.api.model;

/**
 * Status of a payout to a seller.
 * Only PAID payouts count towards settlement totals.
 */
public enum PayoutStatus {
    SCHEDULED,
    PROCESSING,
    PAID,
    FAILED
}
