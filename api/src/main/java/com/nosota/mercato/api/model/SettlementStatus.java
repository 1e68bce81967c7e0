package com.nosota.mercato.api.model;

/**
 * Status of a settlement version.
 */
public enum SettlementStatus {
    /**
     * DRAFT: Generated, still open for adjustments and regeneration.
     */
    DRAFT,

    /**
     * FINALIZED: Locked. No adjustments, no regeneration.
     */
    FINALIZED,

    /**
     * SUPERSEDED: Replaced by a newer version of the same period.
     */
    SUPERSEDED
}
