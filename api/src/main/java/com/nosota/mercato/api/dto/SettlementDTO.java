package com.nosota.mercato.api.dto;

import com.nosota.mercato.api.model.SettlementStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Full settlement aggregate, including line items and adjustments.
 *
 * <p>{@code netAmount = grossSales - refunds - totalCommission + totalAdjustments}.
 * {@code totalPayouts} is informational and not netted.
 *
 * @param id                    Settlement UUID
 * @param settlementNumber      STL-{store}-{yyyyMM}
 * @param storeId               Seller store
 * @param periodStart           Start of period (inclusive)
 * @param periodEnd             End of period (inclusive)
 * @param grossSales            Sum of escrow gross amounts
 * @param refunds               Sum of escrow refunded amounts
 * @param totalCommission       Sum of escrow commission amounts
 * @param totalAdjustments      Sum of manual adjustments
 * @param netAmount             Amount owed to the seller
 * @param totalPayouts          Paid payouts completed in the period
 * @param currency              ISO 4217 code
 * @param status                Current status
 * @param version               Version within the period chain, starting at 1
 * @param currentVersion        True for exactly one settlement per store and period
 * @param previousSettlementId  Version this one replaced, null for version 1
 * @param createdAt             Generation timestamp
 * @param finalizedAt           Finalization timestamp, null unless FINALIZED
 * @param items                 One entry per contributing sub-order
 * @param adjustments           Manual adjustments
 */
public record SettlementDTO(
        UUID id,
        String settlementNumber,
        Long storeId,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        BigDecimal grossSales,
        BigDecimal refunds,
        BigDecimal totalCommission,
        BigDecimal totalAdjustments,
        BigDecimal netAmount,
        BigDecimal totalPayouts,
        String currency,
        SettlementStatus status,
        Integer version,
        boolean currentVersion,
        UUID previousSettlementId,
        LocalDateTime createdAt,
        LocalDateTime finalizedAt,
        List<SettlementItemDTO> items,
        List<SettlementAdjustmentDTO> adjustments
) {
}
