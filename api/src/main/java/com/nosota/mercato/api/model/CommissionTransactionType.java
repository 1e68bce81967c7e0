package com.nosota.mercato.api.model;

/**
 * Kind of commission audit record.
 */
public enum CommissionTransactionType {
    /**
     * INITIAL: Commission charged when the escrow was created.
     */
    INITIAL,

    /**
     * REFUND_ADJUSTMENT: Negative commission returned proportionally to a refund.
     */
    REFUND_ADJUSTMENT
}
