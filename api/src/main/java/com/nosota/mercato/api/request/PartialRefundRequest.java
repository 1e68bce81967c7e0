package com.nosota.mercato.api.request;

import com.nosota.mercato.api.model.RefundInitiator;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request for refunding part of one seller sub-order.
 *
 * @param subOrderId       Sub-order to refund
 * @param amount           Amount to return to the buyer (must be positive)
 * @param reason           Reason for refund (max 500 characters)
 * @param initiator        Who is initiating this refund
 * @param initiatedBy      User ID of the initiator, null for SYSTEM
 * @param returnRequestId  Linked return request, optional
 */
public record PartialRefundRequest(
        @NotNull(message = "Sub-order ID is required")
        UUID subOrderId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @NotNull(message = "Reason is required")
        @Size(min = 1, max = 500, message = "Reason must be between 1 and 500 characters")
        String reason,

        @NotNull(message = "Initiator is required")
        RefundInitiator initiator,

        Long initiatedBy,

        UUID returnRequestId
) {
}
