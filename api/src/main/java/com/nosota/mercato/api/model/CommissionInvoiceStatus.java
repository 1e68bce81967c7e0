package com.nosota.mercato.api.model;

/**
 * Status of a commission invoice or credit note.
 */
public enum CommissionInvoiceStatus {
    /**
     * DRAFT: Generated, not yet sent to the seller.
     */
    DRAFT,

    /**
     * ISSUED: Sent to the seller, awaiting payment.
     */
    ISSUED,

    /**
     * PAID: Settled by the seller. Cannot be cancelled.
     */
    PAID,

    /**
     * CANCELLED: Voided before payment. Final state.
     */
    CANCELLED,

    /**
     * SUPERSEDED: Corrected by a credit note. Final state.
     */
    SUPERSEDED
}
