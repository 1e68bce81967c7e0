package com.nosota.mercato.api.model;

/**
 * Reason category of a manual settlement adjustment.
 */
public enum SettlementAdjustmentType {
    CORRECTION,
    /**
     * PRIOR_PERIOD_ADJUSTMENT: Corrects an amount that belongs to an earlier settlement.
     */
    PRIOR_PERIOD_ADJUSTMENT,
    FEE,
    BONUS,
    OTHER
}
