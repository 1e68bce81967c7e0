package com.nosota.mercato.dto;

import com.nosota.mercato.api.model.CommissionSource;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Internal DTO for commission resolution results.
 *
 * @param commissionAmount      round(gross * percentage / 100 + fixedAmount, 2)
 * @param commissionPercentage  Percentage applied (e.g. 10.0 for 10%)
 * @param fixedCommissionAmount Fixed fee applied per transaction
 * @param source                Override tier the rate came from
 * @param appliedCategoryId     Category whose override was used, null otherwise
 */
@Builder
public record CommissionCalculation(
        BigDecimal commissionAmount,
        BigDecimal commissionPercentage,
        BigDecimal fixedCommissionAmount,
        CommissionSource source,
        Long appliedCategoryId
) {
}
