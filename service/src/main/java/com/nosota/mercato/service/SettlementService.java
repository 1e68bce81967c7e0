package com.nosota.mercato.service;

import com.nosota.mercato.api.dto.SettlementDTO;
import com.nosota.mercato.api.dto.SettlementSummaryDTO;
import com.nosota.mercato.api.model.SettlementAdjustmentType;
import com.nosota.mercato.api.model.SettlementStatus;
import com.nosota.mercato.api.model.StoreStatus;
import com.nosota.mercato.api.request.SettlementAdjustmentRequest;
import com.nosota.mercato.dto.SettlementMapper;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.EscrowTransaction;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.Settlement;
import com.nosota.mercato.model.SettlementAdjustment;
import com.nosota.mercato.model.SettlementItem;
import com.nosota.mercato.model.Store;
import com.nosota.mercato.repository.EscrowTransactionRepository;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.PayoutRepository;
import com.nosota.mercato.repository.SettlementAdjustmentRepository;
import com.nosota.mercato.repository.SettlementItemRepository;
import com.nosota.mercato.repository.SettlementRepository;
import com.nosota.mercato.repository.StoreRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for per-store, per-period settlements.
 *
 * <p>A settlement aggregates the escrows of every sub-order whose order was placed in the period:
 * <pre>
 * grossSales = Σ escrow.gross
 * refunds    = Σ escrow.refunded
 * commission = Σ escrow.commission
 * netAmount  = grossSales - refunds - commission + adjustments
 * </pre>
 * Payouts of the period are reported in {@code totalPayouts} but are not netted.
 *
 * <p>Versioning:
 * <ul>
 *   <li>{@link #generateSettlement} creates version 1 and fails if a live version exists</li>
 *   <li>{@link #regenerateSettlement} supersedes the current version and creates the next one,
 *       carrying adjustments forward, in one transaction</li>
 *   <li>{@link #finalizeSettlement} freezes a version</li>
 * </ul>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyyMM");
    private static final String COPIED_SUFFIX = " (Copied from previous version)";

    private final SettlementRepository settlementRepository;
    private final SettlementItemRepository settlementItemRepository;
    private final SettlementAdjustmentRepository settlementAdjustmentRepository;
    private final EscrowTransactionRepository escrowTransactionRepository;
    private final OrderRepository orderRepository;
    private final PayoutRepository payoutRepository;
    private final StoreRepository storeRepository;
    private final TransactionTemplate transactionTemplate;

    @Value("${marketplace.currency:USD}")
    private String currency;

    /**
     * Generates version 1 of the settlement of a store for a period.
     *
     * @param storeId     The store ID
     * @param periodStart Start of the period (inclusive)
     * @param periodEnd   End of the period (inclusive)
     * @return The new DRAFT settlement
     * @throws InvalidRequestException if the period end is not after its start
     * @throws StateConflictException  if a non-superseded settlement exists for the exact period
     */
    @Transactional
    public Settlement generateSettlement(@NotNull Long storeId,
                                         @NotNull LocalDateTime periodStart,
                                         @NotNull LocalDateTime periodEnd) {
        validatePeriod(periodStart, periodEnd);

        Optional<Settlement> existing = findLiveSettlement(storeId, periodStart, periodEnd);
        if (existing.isPresent()) {
            throw new StateConflictException(String.format(
                    "Settlement %s already exists for store %d and period %s - %s, regenerate it instead",
                    existing.get().getSettlementNumber(), storeId, periodStart, periodEnd));
        }

        Settlement settlement = buildSettlement(storeId, periodStart, periodEnd, 1, null);
        log.info("Generated settlement {} v1 for store {}: gross {}, refunds {}, commission {}, net {}",
                settlement.getSettlementNumber(), storeId, settlement.getGrossSales(), settlement.getRefunds(),
                settlement.getTotalCommission(), settlement.getNetAmount());
        return settlement;
    }

    /**
     * Replaces the current version of a settlement with a freshly aggregated one.
     *
     * <p>The old version becomes SUPERSEDED, the new one gets {@code version + 1}, links to the old one
     * and receives copies of all its adjustments. Both steps commit or roll back together.
     *
     * @param settlementId Version to replace
     * @return The new current version
     * @throws StateConflictException if the settlement is finalized or already superseded
     */
    @Transactional
    public Settlement regenerateSettlement(@NotNull UUID settlementId) {
        Settlement previous = lockSettlement(settlementId);
        if (previous.isFinalized()) {
            throw new StateConflictException(String.format(
                    "Settlement %s is finalized and cannot be regenerated", previous.getSettlementNumber()));
        }
        if (previous.getStatus() == SettlementStatus.SUPERSEDED) {
            throw new StateConflictException(String.format(
                    "Settlement %s v%d has already been superseded", previous.getSettlementNumber(), previous.getVersion()));
        }

        // a failure below rolls back the supersede together with the partial replacement
        previous.supersede();
        settlementRepository.save(previous);

        try {
            Settlement next = buildSettlement(previous.getStoreId(), previous.getPeriodStart(), previous.getPeriodEnd(),
                    previous.getVersion() + 1, previous.getId());

            List<SettlementAdjustment> adjustments =
                    settlementAdjustmentRepository.findBySettlementIdOrderByCreatedAtAsc(previous.getId());
            for (SettlementAdjustment adjustment : adjustments) {
                settlementAdjustmentRepository.save(SettlementAdjustment.builder()
                        .settlementId(next.getId())
                        .type(adjustment.getType())
                        .amount(adjustment.getAmount())
                        .description(adjustment.getDescription().endsWith(COPIED_SUFFIX)
                                ? adjustment.getDescription()
                                : adjustment.getDescription() + COPIED_SUFFIX)
                        .relatedSettlementId(adjustment.getRelatedSettlementId())
                        .priorPeriodAdjustment(adjustment.isPriorPeriodAdjustment())
                        .createdBy(adjustment.getCreatedBy())
                        .createdAt(LocalDateTime.now())
                        .build());
                next.addAdjustment(adjustment.getAmount());
            }
            next = settlementRepository.save(next);

            log.info("Regenerated settlement {}: v{} superseded by v{}, {} adjustment(s) carried, net {}",
                    next.getSettlementNumber(), previous.getVersion(), next.getVersion(), adjustments.size(),
                    next.getNetAmount());
            return next;
        } catch (RuntimeException e) {
            log.error("Failed to regenerate settlement {}, version {} stays current after rollback",
                    previous.getSettlementNumber(), previous.getVersion(), e);
            throw e;
        }
    }

    /**
     * Adds a signed manual adjustment to a draft settlement and recomputes its net amount.
     *
     * @throws StateConflictException if the settlement is finalized or superseded
     */
    @Transactional
    public SettlementAdjustment addAdjustment(@NotNull UUID settlementId,
                                              @NotNull @Valid SettlementAdjustmentRequest request) {
        Settlement settlement = lockSettlement(settlementId);
        if (settlement.isFinalized()) {
            throw new StateConflictException(String.format(
                    "Cannot add adjustment to finalized settlement %s", settlement.getSettlementNumber()));
        }
        if (settlement.getStatus() == SettlementStatus.SUPERSEDED) {
            throw new StateConflictException(String.format(
                    "Cannot add adjustment to superseded settlement %s v%d",
                    settlement.getSettlementNumber(), settlement.getVersion()));
        }

        SettlementAdjustment adjustment = settlementAdjustmentRepository.save(SettlementAdjustment.builder()
                .settlementId(settlementId)
                .type(request.type())
                .amount(request.amount())
                .description(request.description())
                .relatedSettlementId(request.relatedSettlementId())
                .priorPeriodAdjustment(request.type() == SettlementAdjustmentType.PRIOR_PERIOD_ADJUSTMENT)
                .createdBy(request.createdBy())
                .createdAt(LocalDateTime.now())
                .build());

        settlement.addAdjustment(request.amount());
        settlementRepository.save(settlement);

        log.info("Added {} adjustment {} to settlement {}: adjustments {}, net {}",
                request.type(), request.amount(), settlement.getSettlementNumber(),
                settlement.getTotalAdjustments(), settlement.getNetAmount());
        return adjustment;
    }

    /**
     * Finalizes a settlement. Finalizing an already finalized settlement is a no-op.
     *
     * @throws StateConflictException if the settlement has been superseded
     */
    @Transactional
    public Settlement finalizeSettlement(@NotNull UUID settlementId) {
        Settlement settlement = lockSettlement(settlementId);
        if (settlement.isFinalized()) {
            log.info("Settlement {} is already finalized", settlement.getSettlementNumber());
            return settlement;
        }
        if (settlement.getStatus() == SettlementStatus.SUPERSEDED) {
            throw new StateConflictException(String.format(
                    "Superseded settlement %s v%d cannot be finalized",
                    settlement.getSettlementNumber(), settlement.getVersion()));
        }

        settlement.finalizeSettlement();
        settlementRepository.save(settlement);
        log.info("Finalized settlement {} v{}: net {}",
                settlement.getSettlementNumber(), settlement.getVersion(), settlement.getNetAmount());
        return settlement;
    }

    /**
     * Generates settlements for every active store for a calendar month.
     *
     * <p>Each store runs in its own transaction. Stores that already have a live settlement for the
     * month are skipped; a failing store is logged and does not stop the others.
     *
     * @return Number of settlements generated
     * @throws InvalidRequestException if the month is outside 1..12
     */
    public int generateMonthlySettlements(int year, int month) {
        if (month < 1 || month > 12) {
            throw new InvalidRequestException("Month must be between 1 and 12, got " + month);
        }
        YearMonth yearMonth = YearMonth.of(year, month);
        LocalDateTime periodStart = yearMonth.atDay(1).atStartOfDay();
        LocalDateTime periodEnd = yearMonth.atEndOfMonth().atTime(23, 59, 59);

        int generated = 0;
        for (Store store : storeRepository.findByStatusOrderByIdAsc(StoreStatus.ACTIVE)) {
            try {
                Boolean created = transactionTemplate.execute(status -> {
                    if (findLiveSettlement(store.getId(), periodStart, periodEnd).isPresent()) {
                        log.info("Store {} already has a settlement for {}, skipping", store.getId(), yearMonth);
                        return false;
                    }
                    buildSettlement(store.getId(), periodStart, periodEnd, 1, null);
                    return true;
                });
                if (Boolean.TRUE.equals(created)) {
                    generated++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to generate settlement for store {} and period {}", store.getId(), yearMonth, e);
            }
        }

        log.info("Generated {} settlement(s) for {}", generated, yearMonth);
        return generated;
    }

    /**
     * Computes the totals a settlement for the period would have, without persisting anything.
     */
    public SettlementSummaryDTO getSettlementSummary(@NotNull Long storeId,
                                                     @NotNull LocalDateTime periodStart,
                                                     @NotNull LocalDateTime periodEnd) {
        validatePeriod(periodStart, periodEnd);

        List<EscrowTransaction> escrows =
                escrowTransactionRepository.findByStoreIdAndOrderedAtBetween(storeId, periodStart, periodEnd);
        BigDecimal gross = sum(escrows, EscrowTransaction::getGrossAmount);
        BigDecimal refunds = sum(escrows, EscrowTransaction::getRefundedAmount);
        BigDecimal commission = sum(escrows, EscrowTransaction::getCommissionAmount);
        UUID existingId = findLiveSettlement(storeId, periodStart, periodEnd)
                .map(Settlement::getId)
                .orElse(null);

        return new SettlementSummaryDTO(
                storeId,
                periodStart,
                periodEnd,
                escrows.size(),
                gross,
                refunds,
                commission,
                gross.subtract(refunds).subtract(commission),
                payoutRepository.sumPaidAmount(storeId, periodStart, periodEnd),
                existingId);
    }

    /**
     * Full settlement aggregate with items and adjustments.
     */
    public SettlementDTO getSettlement(@NotNull UUID settlementId) {
        Settlement settlement = settlementRepository.findById(settlementId)
                .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));
        return toDTO(settlement);
    }

    public List<SettlementDTO> getSettlements(@NotNull Long storeId, boolean includeSuperseded) {
        List<Settlement> settlements = includeSuperseded
                ? settlementRepository.findByStoreIdOrderByPeriodStartDescVersionDesc(storeId)
                : settlementRepository.findByStoreIdAndStatusNotOrderByPeriodStartDescVersionDesc(
                        storeId, SettlementStatus.SUPERSEDED);
        return settlements.stream()
                .map(this::toDTO)
                .toList();
    }

    private Settlement buildSettlement(Long storeId, LocalDateTime periodStart, LocalDateTime periodEnd,
                                       int version, UUID previousSettlementId) {
        List<EscrowTransaction> escrows =
                escrowTransactionRepository.findByStoreIdAndOrderedAtBetween(storeId, periodStart, periodEnd);

        Settlement settlement = new Settlement();
        settlement.setSettlementNumber(settlementNumber(storeId, periodStart));
        settlement.setStoreId(storeId);
        settlement.setPeriodStart(periodStart);
        settlement.setPeriodEnd(periodEnd);
        settlement.setGrossSales(sum(escrows, EscrowTransaction::getGrossAmount));
        settlement.setRefunds(sum(escrows, EscrowTransaction::getRefundedAmount));
        settlement.setTotalCommission(sum(escrows, EscrowTransaction::getCommissionAmount));
        settlement.setTotalAdjustments(BigDecimal.ZERO);
        settlement.setTotalPayouts(payoutRepository.sumPaidAmount(storeId, periodStart, periodEnd));
        settlement.setCurrency(currency);
        settlement.setStatus(SettlementStatus.DRAFT);
        settlement.setVersion(version);
        settlement.setCurrentVersion(true);
        settlement.setPreviousSettlementId(previousSettlementId);
        settlement.setCreatedAt(LocalDateTime.now());
        settlement.recalculateNetAmount();
        settlement = settlementRepository.save(settlement);

        Map<UUID, Order> orders = orderRepository.findAllById(
                        escrows.stream().map(EscrowTransaction::getOrderId).distinct().toList()).stream()
                .collect(Collectors.toMap(Order::getId, Function.identity()));

        for (EscrowTransaction escrow : escrows) {
            Order order = orders.get(escrow.getOrderId());
            settlementItemRepository.save(SettlementItem.builder()
                    .settlementId(settlement.getId())
                    .subOrderId(escrow.getSubOrderId())
                    .escrowTransactionId(escrow.getId())
                    .orderNumber(order != null ? order.getOrderNumber() : escrow.getOrderId().toString())
                    .grossAmount(escrow.getGrossAmount())
                    .refundAmount(escrow.getRefundedAmount())
                    .commissionAmount(escrow.getCommissionAmount())
                    .netAmount(escrow.getNetAmount())
                    .orderedAt(order != null ? order.getOrderedAt() : escrow.getCreatedAt())
                    .build());
        }
        return settlement;
    }

    private Optional<Settlement> findLiveSettlement(Long storeId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        return settlementRepository.findFirstByStoreIdAndPeriodStartAndPeriodEndAndStatusNot(
                storeId, periodStart, periodEnd, SettlementStatus.SUPERSEDED);
    }

    private Settlement lockSettlement(UUID settlementId) {
        return settlementRepository.findByIdForUpdate(settlementId)
                .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));
    }

    private SettlementDTO toDTO(Settlement settlement) {
        return SettlementMapper.INSTANCE.toDTO(
                settlement,
                settlementItemRepository.findBySettlementIdOrderByOrderedAtAsc(settlement.getId()),
                settlementAdjustmentRepository.findBySettlementIdOrderByCreatedAtAsc(settlement.getId()));
    }

    private static void validatePeriod(LocalDateTime periodStart, LocalDateTime periodEnd) {
        if (!periodEnd.isAfter(periodStart)) {
            throw new InvalidRequestException(String.format(
                    "Period end %s must be after period start %s", periodEnd, periodStart));
        }
    }

    private static String settlementNumber(Long storeId, LocalDateTime periodStart) {
        return String.format("STL-%06d-%s", storeId, periodStart.format(PERIOD_FORMAT));
    }

    private static BigDecimal sum(List<EscrowTransaction> escrows, Function<EscrowTransaction, BigDecimal> field) {
        return escrows.stream()
                .map(field)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
