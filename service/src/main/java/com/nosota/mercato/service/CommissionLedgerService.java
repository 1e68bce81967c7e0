package com.nosota.mercato.service;

import com.nosota.mercato.api.dto.CommissionTransactionDTO;
import com.nosota.mercato.api.model.CommissionSource;
import com.nosota.mercato.api.model.CommissionTransactionType;
import com.nosota.mercato.dto.CommissionTransactionMapper;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.model.CommissionTransaction;
import com.nosota.mercato.model.EscrowTransaction;
import com.nosota.mercato.repository.CommissionTransactionRepository;
import com.nosota.mercato.repository.EscrowTransactionRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only ledger of commission calculations.
 *
 * <p>The service provides:
 * <ul>
 *   <li>Recording INITIAL and REFUND_ADJUSTMENT transactions (never updated afterwards)</li>
 *   <li>Proportional commission reversal for refunds</li>
 *   <li>Read access by store, escrow and period</li>
 * </ul>
 *
 * <p>Refund reversal:
 * <pre>
 * ratio            = refundAmount / initial.grossAmount
 * commissionRefund = round(originalCommission * ratio, 2)
 * adjustment       = -commissionRefund   (recorded with fixed fee 0, returned to caller)
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CommissionLedgerService {

    private final CommissionTransactionRepository commissionTransactionRepository;
    private final EscrowTransactionRepository escrowTransactionRepository;

    /**
     * Writes an immutable commission record.
     *
     * @return The saved record
     * @throws IllegalArgumentException if type or source is missing
     */
    @Transactional
    public CommissionTransaction recordTransaction(UUID escrowTransactionId,
                                                   Long storeId,
                                                   Long categoryId,
                                                   CommissionTransactionType type,
                                                   BigDecimal grossAmount,
                                                   BigDecimal commissionAmount,
                                                   BigDecimal commissionPercentage,
                                                   BigDecimal fixedCommissionAmount,
                                                   CommissionSource source,
                                                   String notes) {
        if (type == null) {
            throw new IllegalArgumentException("Commission transaction type must be INITIAL or REFUND_ADJUSTMENT");
        }
        if (source == null) {
            throw new IllegalArgumentException("Commission source must be GLOBAL, SELLER or CATEGORY");
        }
        if (escrowTransactionId == null || storeId == null) {
            throw new IllegalArgumentException("Escrow transaction and store are required for a commission record");
        }

        CommissionTransaction transaction = commissionTransactionRepository.save(CommissionTransaction.builder()
                .escrowTransactionId(escrowTransactionId)
                .storeId(storeId)
                .categoryId(categoryId)
                .transactionType(type)
                .grossAmount(grossAmount)
                .commissionAmount(commissionAmount)
                .commissionPercentage(commissionPercentage)
                .fixedCommissionAmount(fixedCommissionAmount)
                .commissionSource(source)
                .notes(notes)
                .createdAt(LocalDateTime.now())
                .build());

        log.info("Recorded {} commission {} on gross {} for escrow {} (store {}, source {})",
                type, commissionAmount, grossAmount, escrowTransactionId, storeId, source);
        return transaction;
    }

    /**
     * Reverses commission proportionally to a refund and records the adjustment.
     *
     * <p>Returns zero, without recording anything, when the escrow has no INITIAL record or
     * its gross amount is not positive.
     *
     * @param escrowTransactionId      Escrow being refunded
     * @param refundAmount             Amount returned to the buyer
     * @param originalCommissionAmount Commission charged at creation
     * @return The adjustment, negative or zero, to add to running commission totals
     * @throws ResourceNotFoundException if the escrow does not exist
     */
    @Transactional
    public BigDecimal recalculateForRefund(@NotNull UUID escrowTransactionId,
                                           @NotNull BigDecimal refundAmount,
                                           @NotNull BigDecimal originalCommissionAmount) {
        EscrowTransaction escrow = escrowTransactionRepository.findById(escrowTransactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Escrow transaction", escrowTransactionId));

        Optional<CommissionTransaction> initial = commissionTransactionRepository
                .findFirstByEscrowTransactionIdAndTransactionTypeOrderByCreatedAtDesc(
                        escrowTransactionId, CommissionTransactionType.INITIAL);
        if (initial.isEmpty()) {
            log.warn("No initial commission transaction for escrow {}, commission not reversed", escrowTransactionId);
            return BigDecimal.ZERO;
        }

        CommissionTransaction original = initial.get();
        if (original.getGrossAmount().signum() <= 0) {
            log.warn("Initial gross amount of escrow {} is {}, cannot compute refund ratio",
                    escrowTransactionId, original.getGrossAmount());
            return BigDecimal.ZERO;
        }

        BigDecimal ratio = refundAmount.divide(original.getGrossAmount(), MathContext.DECIMAL64);
        BigDecimal commissionRefund = originalCommissionAmount.multiply(ratio).setScale(2, RoundingMode.HALF_UP);
        BigDecimal adjustment = commissionRefund.negate();

        recordTransaction(
                escrowTransactionId,
                escrow.getStoreId(),
                original.getCategoryId(),
                CommissionTransactionType.REFUND_ADJUSTMENT,
                refundAmount,
                adjustment,
                original.getCommissionPercentage(),
                // fixed fee is already part of the ratio
                BigDecimal.ZERO,
                original.getCommissionSource(),
                String.format("Refund of %s out of %s", refundAmount, original.getGrossAmount()));

        log.info("Reversed commission {} on escrow {} for refund {} (ratio {})",
                adjustment, escrowTransactionId, refundAmount, ratio);
        return adjustment;
    }

    /**
     * Commission records of a store created between two dates, both inclusive.
     */
    public List<CommissionTransactionDTO> getTransactionsByStore(@NotNull Long storeId,
                                                                 @NotNull LocalDate from,
                                                                 @NotNull LocalDate to) {
        return CommissionTransactionMapper.INSTANCE.toDTOList(findTransactionsByStore(storeId, from, to));
    }

    public List<CommissionTransactionDTO> getTransactionsByEscrow(@NotNull UUID escrowTransactionId) {
        return CommissionTransactionMapper.INSTANCE.toDTOList(
                commissionTransactionRepository.findByEscrowTransactionIdOrderByCreatedAtAsc(escrowTransactionId));
    }

    /**
     * Net platform commission over all stores, refund adjustments included.
     */
    public BigDecimal getTotalCommission(@NotNull LocalDateTime from, @NotNull LocalDateTime to) {
        return commissionTransactionRepository.sumCommissionBetween(from, to);
    }

    List<CommissionTransaction> findTransactionsByStore(Long storeId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new InvalidRequestException(String.format("Period end %s is before start %s", to, from));
        }
        return commissionTransactionRepository
                .findByStoreIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
                        storeId, from.atStartOfDay(), to.plusDays(1).atStartOfDay());
    }
}
