package com.nosota.mercato.api.dto;

import com.nosota.mercato.api.model.CommissionSource;
import com.nosota.mercato.api.model.CommissionTransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Commission audit record.
 *
 * @param commissionAmount Charged commission, negative for refund adjustments
 */
public record CommissionTransactionDTO(
        UUID id,
        UUID escrowTransactionId,
        Long storeId,
        Long categoryId,
        CommissionTransactionType transactionType,
        BigDecimal grossAmount,
        BigDecimal commissionPercentage,
        BigDecimal fixedCommissionAmount,
        BigDecimal commissionAmount,
        CommissionSource commissionSource,
        String notes,
        LocalDateTime createdAt
) {
}
