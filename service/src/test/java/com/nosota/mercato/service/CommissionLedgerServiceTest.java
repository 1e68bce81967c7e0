package com.nosota.mercato.service;

import com.nosota.mercato.api.model.CommissionSource;
import com.nosota.mercato.api.model.CommissionTransactionType;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.model.CommissionTransaction;
import com.nosota.mercato.model.EscrowTransaction;
import com.nosota.mercato.repository.CommissionTransactionRepository;
import com.nosota.mercato.repository.EscrowTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Commission ledger")
class CommissionLedgerServiceTest {

    private static final Long STORE_ID = 11L;

    @Mock
    private CommissionTransactionRepository commissionTransactionRepository;

    @Mock
    private EscrowTransactionRepository escrowTransactionRepository;

    private CommissionLedgerService ledgerService;

    private UUID escrowId;

    @BeforeEach
    void setUp() {
        ledgerService = new CommissionLedgerService(commissionTransactionRepository, escrowTransactionRepository);
        escrowId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Refund of half the gross reverses half the commission")
    void proportionalReversal() {
        givenEscrow();
        when(commissionTransactionRepository.findFirstByEscrowTransactionIdAndTransactionTypeOrderByCreatedAtDesc(
                escrowId, CommissionTransactionType.INITIAL))
                .thenReturn(Optional.of(initial(new BigDecimal("100.00"), new BigDecimal("10.00"))));

        BigDecimal adjustment = ledgerService.recalculateForRefund(
                escrowId, new BigDecimal("50.00"), new BigDecimal("10.00"));

        assertThat(adjustment).isEqualTo(new BigDecimal("-5.00"));

        ArgumentCaptor<CommissionTransaction> captor = ArgumentCaptor.forClass(CommissionTransaction.class);
        verify(commissionTransactionRepository).save(captor.capture());
        CommissionTransaction recorded = captor.getValue();
        assertThat(recorded.getTransactionType()).isEqualTo(CommissionTransactionType.REFUND_ADJUSTMENT);
        assertThat(recorded.getCommissionAmount()).isEqualByComparingTo("-5.00");
        assertThat(recorded.getGrossAmount()).isEqualByComparingTo("50.00");
        assertThat(recorded.getFixedCommissionAmount()).isEqualByComparingTo("0");
        assertThat(recorded.getCommissionSource()).isEqualTo(CommissionSource.GLOBAL);
        assertThat(recorded.getStoreId()).isEqualTo(STORE_ID);
    }

    @Test
    @DisplayName("Reversal includes the fixed fee share and rounds half up")
    void reversalWithFixedFee() {
        givenEscrow();
        // 10% of 30.00 plus 0.30 fixed
        when(commissionTransactionRepository.findFirstByEscrowTransactionIdAndTransactionTypeOrderByCreatedAtDesc(
                escrowId, CommissionTransactionType.INITIAL))
                .thenReturn(Optional.of(initial(new BigDecimal("30.00"), new BigDecimal("3.30"))));

        BigDecimal adjustment = ledgerService.recalculateForRefund(
                escrowId, new BigDecimal("10.00"), new BigDecimal("3.30"));

        assertThat(adjustment).isEqualTo(new BigDecimal("-1.10"));
    }

    @Test
    @DisplayName("Zero original gross gives zero without recording")
    void zeroGross() {
        givenEscrow();
        when(commissionTransactionRepository.findFirstByEscrowTransactionIdAndTransactionTypeOrderByCreatedAtDesc(
                escrowId, CommissionTransactionType.INITIAL))
                .thenReturn(Optional.of(initial(BigDecimal.ZERO, BigDecimal.ZERO)));

        BigDecimal adjustment = ledgerService.recalculateForRefund(escrowId, new BigDecimal("5.00"), BigDecimal.ZERO);

        assertThat(adjustment).isEqualByComparingTo("0");
        verify(commissionTransactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Missing initial transaction gives zero without recording")
    void missingInitial() {
        givenEscrow();
        when(commissionTransactionRepository.findFirstByEscrowTransactionIdAndTransactionTypeOrderByCreatedAtDesc(
                escrowId, CommissionTransactionType.INITIAL))
                .thenReturn(Optional.empty());

        BigDecimal adjustment = ledgerService.recalculateForRefund(
                escrowId, new BigDecimal("5.00"), new BigDecimal("1.00"));

        assertThat(adjustment).isEqualByComparingTo("0");
        verify(commissionTransactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unknown escrow is reported as not found")
    void unknownEscrow() {
        when(escrowTransactionRepository.findById(escrowId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.recalculateForRefund(
                escrowId, new BigDecimal("5.00"), new BigDecimal("1.00")))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Records need a type and a source")
    void recordRequiresTypeAndSource() {
        assertThatThrownBy(() -> ledgerService.recordTransaction(escrowId, STORE_ID, null, null,
                BigDecimal.TEN, BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO, CommissionSource.GLOBAL, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.recordTransaction(escrowId, STORE_ID, null,
                CommissionTransactionType.INITIAL, BigDecimal.TEN, BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO,
                null, null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(commissionTransactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Store history covers whole days, end date included")
    void storeHistoryRange() {
        LocalDate from = LocalDate.of(2024, 3, 1);
        LocalDate to = LocalDate.of(2024, 3, 31);
        when(commissionTransactionRepository
                .findByStoreIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
                        STORE_ID, from.atStartOfDay(), LocalDate.of(2024, 4, 1).atStartOfDay()))
                .thenReturn(List.of(initial(new BigDecimal("100.00"), new BigDecimal("10.00"))));

        assertThat(ledgerService.getTransactionsByStore(STORE_ID, from, to))
                .singleElement()
                .satisfies(dto -> assertThat(dto.commissionAmount()).isEqualByComparingTo("10.00"));
    }

    @Test
    @DisplayName("Inverted period is rejected")
    void invertedPeriod() {
        assertThatThrownBy(() -> ledgerService.getTransactionsByStore(
                STORE_ID, LocalDate.of(2024, 3, 31), LocalDate.of(2024, 3, 1)))
                .isInstanceOf(InvalidRequestException.class);
    }

    private void givenEscrow() {
        EscrowTransaction escrow = new EscrowTransaction();
        escrow.setId(escrowId);
        escrow.setStoreId(STORE_ID);
        when(escrowTransactionRepository.findById(escrowId)).thenReturn(Optional.of(escrow));
    }

    private CommissionTransaction initial(BigDecimal gross, BigDecimal commission) {
        return CommissionTransaction.builder()
                .id(UUID.randomUUID())
                .escrowTransactionId(escrowId)
                .storeId(STORE_ID)
                .transactionType(CommissionTransactionType.INITIAL)
                .grossAmount(gross)
                .commissionAmount(commission)
                .commissionPercentage(BigDecimal.TEN)
                .fixedCommissionAmount(BigDecimal.ZERO)
                .commissionSource(CommissionSource.GLOBAL)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
