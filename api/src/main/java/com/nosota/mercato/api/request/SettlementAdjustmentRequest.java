package com.nosota.mercato.api.request;

import com.nosota.mercato.api.model.SettlementAdjustmentType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Manual correction added to a draft settlement.
 *
 * @param type                 Adjustment category
 * @param amount               Signed amount: positive credits the seller, negative debits
 * @param description          Free text shown on the settlement (max 500 characters)
 * @param relatedSettlementId  Earlier settlement this corrects, optional
 * @param createdBy            User ID of the admin, optional
 */
public record SettlementAdjustmentRequest(
        @NotNull(message = "Adjustment type is required")
        SettlementAdjustmentType type,

        @NotNull(message = "Amount is required")
        BigDecimal amount,

        @NotNull(message = "Description is required")
        @Size(min = 1, max = 500, message = "Description must be between 1 and 500 characters")
        String description,

        UUID relatedSettlementId,

        Long createdBy
) {
}
