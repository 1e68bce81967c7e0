package com.nosota.mercato.api.request;

import com.nosota.mercato.api.model.RefundInitiator;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Request for refunding everything that is still refundable on an order.
 *
 * @param orderId      Order to refund
 * @param reason       Reason for refund (max 500 characters)
 * @param initiator    Who is initiating this refund
 * @param initiatedBy  User ID of the initiator, null for SYSTEM
 */
public record FullRefundRequest(
        @NotNull(message = "Order ID is required")
        UUID orderId,

        @NotNull(message = "Reason is required")
        @Size(min = 1, max = 500, message = "Reason must be between 1 and 500 characters")
        String reason,

        @NotNull(message = "Initiator is required")
        RefundInitiator initiator,

        Long initiatedBy
) {
}
