package com.nosota.mercato.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One contributing sub-order of a settlement.
 *
 * @param id                   Item UUID
 * @param subOrderId           Contributing sub-order
 * @param escrowTransactionId  Escrow the amounts were read from
 * @param orderNumber          Buyer-facing order number
 * @param grossAmount          Escrow gross amount
 * @param refundAmount         Refunded so far
 * @param commissionAmount     Commission after refund adjustments
 * @param netAmount            Seller's share
 * @param orderedAt            Order placement time (defines period membership)
 */
public record SettlementItemDTO(
        UUID id,
        UUID subOrderId,
        UUID escrowTransactionId,
        String orderNumber,
        BigDecimal grossAmount,
        BigDecimal refundAmount,
        BigDecimal commissionAmount,
        BigDecimal netAmount,
        LocalDateTime orderedAt
) {
}
