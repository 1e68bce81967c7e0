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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Commission rule resolution")
class CommissionRuleResolverTest {

    private static final Long STORE_ID = 7L;
    private static final Long CATEGORY_ID = 3L;

    @Mock
    private StoreRepository storeRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private CommissionConfigRepository commissionConfigRepository;

    @InjectMocks
    private CommissionRuleResolver resolver;

    @Test
    @DisplayName("Category override wins over store and global rules")
    void categoryOverride() {
        when(categoryRepository.findById(CATEGORY_ID))
                .thenReturn(Optional.of(category(new BigDecimal("15"), null)));

        CommissionCalculation result = resolver.resolve(new BigDecimal("200.00"), STORE_ID, CATEGORY_ID);

        assertThat(result.source()).isEqualTo(CommissionSource.CATEGORY);
        assertThat(result.commissionAmount()).isEqualByComparingTo("30.00");
        assertThat(result.fixedCommissionAmount()).isEqualByComparingTo("0");
        assertThat(result.appliedCategoryId()).isEqualTo(CATEGORY_ID);
        verifyNoInteractions(storeRepository, commissionConfigRepository);
    }

    @Test
    @DisplayName("Store override applies when the category has none")
    void sellerOverride() {
        when(categoryRepository.findById(CATEGORY_ID)).thenReturn(Optional.of(category(null, null)));
        when(storeRepository.findById(STORE_ID))
                .thenReturn(Optional.of(store(new BigDecimal("8"), new BigDecimal("0.50"))));

        CommissionCalculation result = resolver.resolve(new BigDecimal("200.00"), STORE_ID, CATEGORY_ID);

        assertThat(result.source()).isEqualTo(CommissionSource.SELLER);
        assertThat(result.commissionAmount()).isEqualByComparingTo("16.50");
        assertThat(result.appliedCategoryId()).isNull();
        verifyNoInteractions(commissionConfigRepository);
    }

    @Test
    @DisplayName("Global configuration applies without overrides")
    void globalRule() {
        when(storeRepository.findById(STORE_ID)).thenReturn(Optional.of(store(null, null)));
        when(commissionConfigRepository.findFirstByActiveTrueOrderByEffectiveFromDesc())
                .thenReturn(Optional.of(config(new BigDecimal("10"), BigDecimal.ZERO)));

        CommissionCalculation result = resolver.resolve(new BigDecimal("200.00"), STORE_ID, null);

        assertThat(result.source()).isEqualTo(CommissionSource.GLOBAL);
        assertThat(result.commissionAmount()).isEqualByComparingTo("20.00");
        assertThat(result.commissionPercentage()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Unknown category is ignored")
    void unknownCategory() {
        when(categoryRepository.findById(CATEGORY_ID)).thenReturn(Optional.empty());
        when(storeRepository.findById(STORE_ID)).thenReturn(Optional.of(store(null, null)));
        when(commissionConfigRepository.findFirstByActiveTrueOrderByEffectiveFromDesc())
                .thenReturn(Optional.of(config(new BigDecimal("10"), BigDecimal.ZERO)));

        CommissionCalculation result = resolver.resolve(new BigDecimal("50.00"), STORE_ID, CATEGORY_ID);

        assertThat(result.source()).isEqualTo(CommissionSource.GLOBAL);
        assertThat(result.commissionAmount()).isEqualByComparingTo("5.00");
    }

    @Test
    @DisplayName("No active configuration charges nothing")
    void noConfiguration() {
        when(storeRepository.findById(STORE_ID)).thenReturn(Optional.of(store(null, null)));
        when(commissionConfigRepository.findFirstByActiveTrueOrderByEffectiveFromDesc()).thenReturn(Optional.empty());

        CommissionCalculation result = resolver.resolve(new BigDecimal("200.00"), STORE_ID, null);

        assertThat(result.source()).isEqualTo(CommissionSource.GLOBAL);
        assertThat(result.commissionAmount()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Commission is rounded half up to cents")
    void rounding() {
        when(storeRepository.findById(STORE_ID))
                .thenReturn(Optional.of(store(new BigDecimal("7.5"), null)));

        CommissionCalculation result = resolver.resolve(new BigDecimal("33.33"), STORE_ID, null);

        // 33.33 * 7.5% = 2.499975
        assertThat(result.commissionAmount()).isEqualTo(new BigDecimal("2.50"));
    }

    @Test
    @DisplayName("Missing store is reported as not found")
    void missingStore() {
        when(storeRepository.findById(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(new BigDecimal("10.00"), STORE_ID, null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Store");
        verify(storeRepository).findById(STORE_ID);
    }

    private static Category category(BigDecimal percentage, BigDecimal fixed) {
        Category category = new Category();
        category.setId(CATEGORY_ID);
        category.setName("Books");
        category.setCommissionPercentageOverride(percentage);
        category.setFixedCommissionAmountOverride(fixed);
        return category;
    }

    private static Store store(BigDecimal percentage, BigDecimal fixed) {
        Store store = new Store();
        store.setId(STORE_ID);
        store.setStoreName("Corner Shop");
        store.setCommissionPercentageOverride(percentage);
        store.setFixedCommissionAmountOverride(fixed);
        return store;
    }

    private static CommissionConfig config(BigDecimal percentage, BigDecimal fixed) {
        CommissionConfig config = new CommissionConfig();
        config.setGlobalCommissionPercentage(percentage);
        config.setGlobalFixedCommissionAmount(fixed);
        config.setActive(true);
        return config;
    }
}
