package com.nosota.mercato.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Preview of settlement totals for a store and period, computed without persisting anything.
 *
 * @param storeId              Seller store
 * @param periodStart          Start of period (inclusive)
 * @param periodEnd            End of period (inclusive)
 * @param orderCount           Contributing sub-orders
 * @param grossSales           Sum of escrow gross amounts
 * @param refunds              Sum of escrow refunded amounts
 * @param totalCommission      Sum of escrow commission amounts
 * @param netAmount            grossSales - refunds - totalCommission
 * @param totalPayouts         Paid payouts completed in the period
 * @param existingSettlementId Current settlement for the exact period, null if none
 */
public record SettlementSummaryDTO(
        Long storeId,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        int orderCount,
        BigDecimal grossSales,
        BigDecimal refunds,
        BigDecimal totalCommission,
        BigDecimal netAmount,
        BigDecimal totalPayouts,
        UUID existingSettlementId
) {
}
