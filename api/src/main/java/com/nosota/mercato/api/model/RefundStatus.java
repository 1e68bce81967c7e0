package com.nosota.mercato.api.model;

/**
 * Refund status.
 * Tracks the lifecycle of a refund from request to provider confirmation.
 */
public enum RefundStatus {
    /**
     * REQUESTED: Refund record created, eligibility checks passed.
     */
    REQUESTED,

    /**
     * PROCESSING: Payment provider call in progress.
     * Temporary state while the reversal is being executed.
     */
    PROCESSING,

    /**
     * COMPLETED: Provider confirmed the reversal and balances were updated.
     * This is a final state.
     */
    COMPLETED,

    /**
     * FAILED: Provider call failed or timed out.
     * The error message is kept on the refund. Can be retried manually.
     */
    FAILED
}
