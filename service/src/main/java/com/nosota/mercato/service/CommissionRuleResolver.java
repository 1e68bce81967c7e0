package com.nosota.mercato.service;

import com.nosota.mercato.api.model.CommissionSource;
import com.nosota.mercato.dto.CommissionCalculation;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.model.Category;
import com.nosota.mercato.model.CommissionConfig;
import com.nosota.mercato.model.Store;
import com.nosota.mercato.repository.CategoryRepository;
import com.nosota.mercato.repository.CommissionConfigRepository;
import com.nosota.mercato.repository.StoreRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Resolves the commission rate for a sale.
 *
 * <p>Resolution order, first match wins:
 * <ol>
 *   <li>category has a percentage or fixed fee override → CATEGORY</li>
 *   <li>store has a percentage or fixed fee override → SELLER</li>
 *   <li>active global configuration → GLOBAL (0% when none is configured)</li>
 * </ol>
 *
 * <p>{@code commission = round(gross * percentage / 100 + fixedFee, 2)}, half away from zero.
 * A null half of an override counts as zero.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CommissionRuleResolver {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final StoreRepository storeRepository;
    private final CategoryRepository categoryRepository;
    private final CommissionConfigRepository commissionConfigRepository;

    /**
     * @param grossAmount Sale amount the commission is charged on
     * @param storeId     Selling store
     * @param categoryId  Category of the sale, null if mixed or unknown
     * @return Commission amount and the rule it came from
     * @throws ResourceNotFoundException if the store does not exist
     */
    public CommissionCalculation resolve(@NotNull BigDecimal grossAmount, @NotNull Long storeId, Long categoryId) {
        if (categoryId != null) {
            Optional<Category> category = categoryRepository.findById(categoryId);
            if (category.isPresent() && category.get().hasCommissionOverride()) {
                Category c = category.get();
                return calculate(grossAmount, c.getCommissionPercentageOverride(),
                        c.getFixedCommissionAmountOverride(), CommissionSource.CATEGORY, categoryId);
            }
            if (category.isEmpty()) {
                log.warn("Category {} not found, ignoring it for commission of store {}", categoryId, storeId);
            }
        }

        Store store = storeRepository.findById(storeId)
                .orElseThrow(() -> new ResourceNotFoundException("Store", storeId));
        if (store.hasCommissionOverride()) {
            return calculate(grossAmount, store.getCommissionPercentageOverride(),
                    store.getFixedCommissionAmountOverride(), CommissionSource.SELLER, null);
        }

        Optional<CommissionConfig> config = commissionConfigRepository.findFirstByActiveTrueOrderByEffectiveFromDesc();
        if (config.isEmpty()) {
            log.warn("No active global commission configuration, charging 0% to store {}", storeId);
            return calculate(grossAmount, BigDecimal.ZERO, BigDecimal.ZERO, CommissionSource.GLOBAL, null);
        }
        return calculate(grossAmount, config.get().getGlobalCommissionPercentage(),
                config.get().getGlobalFixedCommissionAmount(), CommissionSource.GLOBAL, null);
    }

    static BigDecimal commissionAmount(BigDecimal grossAmount, BigDecimal percentage, BigDecimal fixedAmount) {
        return grossAmount.multiply(percentage)
                .divide(HUNDRED)
                .add(fixedAmount)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private CommissionCalculation calculate(BigDecimal grossAmount, BigDecimal percentage, BigDecimal fixedAmount,
                                            CommissionSource source, Long appliedCategoryId) {
        BigDecimal pct = percentage != null ? percentage : BigDecimal.ZERO;
        BigDecimal fixed = fixedAmount != null ? fixedAmount : BigDecimal.ZERO;
        BigDecimal amount = commissionAmount(grossAmount, pct, fixed);

        log.debug("Commission for gross {}: {} ({}% + {}) from {}", grossAmount, amount, pct, fixed, source);

        return CommissionCalculation.builder()
                .commissionAmount(amount)
                .commissionPercentage(pct)
                .fixedCommissionAmount(fixed)
                .source(source)
                .appliedCategoryId(appliedCategoryId)
                .build();
    }
}
