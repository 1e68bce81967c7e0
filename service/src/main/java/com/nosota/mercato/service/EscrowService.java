package com.nosota.mercato.service;

import com.nosota.mercato.api.model.CommissionTransactionType;
import com.nosota.mercato.api.model.EscrowStatus;
import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
import com.nosota.mercato.dto.CommissionCalculation;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.EscrowTransaction;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.OrderItem;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.repository.EscrowTransactionRepository;
import com.nosota.mercato.repository.OrderItemRepository;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.SellerSubOrderRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for funds held on behalf of sellers.
 *
 * <p>Escrow workflow:
 * <pre>
 * 1. Order paid → one HELD escrow per sub-order, INITIAL commission recorded
 * 2. Refunds    → refunded/commission/net updated, PARTIALLY_REFUNDED or RETURNED_TO_BUYER
 * 3. Delivered  → RELEASED to the seller, no further refunds
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final EscrowTransactionRepository escrowTransactionRepository;
    private final OrderRepository orderRepository;
    private final SellerSubOrderRepository subOrderRepository;
    private final OrderItemRepository orderItemRepository;
    private final CommissionRuleResolver commissionRuleResolver;
    private final CommissionLedgerService commissionLedgerService;

    /**
     * Creates the escrow of every sub-order of a paid order.
     *
     * <p>Idempotent: sub-orders that already have an escrow are skipped and their escrow returned.
     * The commission category is the category shared by all items of a sub-order, if there is one.
     *
     * @param orderId The order ID
     * @return Escrows of all sub-orders of the order
     * @throws ResourceNotFoundException if the order does not exist
     * @throws StateConflictException    if the payment is not completed
     */
    @Transactional
    public List<EscrowTransaction> createEscrowAllocations(@NotNull UUID orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        if (order.getPaymentStatus() != PaymentStatus.COMPLETED) {
            throw new StateConflictException(String.format(
                    "Cannot create escrow for order %s with payment status %s", orderId, order.getPaymentStatus()));
        }

        List<EscrowTransaction> escrows = new ArrayList<>();
        for (SellerSubOrder subOrder : subOrderRepository.findByOrderId(orderId)) {
            Optional<EscrowTransaction> existing = escrowTransactionRepository.findBySubOrderId(subOrder.getId());
            if (existing.isPresent()) {
                escrows.add(existing.get());
                continue;
            }
            escrows.add(createEscrow(order, subOrder));
        }

        log.info("Escrow allocations for order {}: {} escrow(s)", orderId, escrows.size());
        return escrows;
    }

    /**
     * Books a refund on the escrow of a sub-order and reverses commission proportionally.
     *
     * @param subOrderId   The refunded sub-order
     * @param refundAmount Amount returned to the buyer
     * @return Commission adjustment (negative or zero); zero when the sub-order has no escrow
     * @throws StateConflictException if the escrow was released or the refund exceeds its balance
     */
    @Transactional
    public BigDecimal recordRefund(@NotNull UUID subOrderId, @NotNull BigDecimal refundAmount) {
        Optional<EscrowTransaction> found = escrowTransactionRepository.findBySubOrderId(subOrderId);
        if (found.isEmpty()) {
            log.warn("Sub-order {} has no escrow, refund of {} booked without commission reversal",
                    subOrderId, refundAmount);
            return BigDecimal.ZERO;
        }

        EscrowTransaction escrow = found.get();
        checkRefundable(escrow, refundAmount);

        BigDecimal adjustment = commissionLedgerService.recalculateForRefund(
                escrow.getId(), refundAmount, escrow.getOriginalCommissionAmount());
        escrow.applyRefund(refundAmount, adjustment);
        escrowTransactionRepository.save(escrow);

        log.info("Escrow {} refunded {}: refunded total {}, commission {}, net {}, status {}",
                escrow.getId(), refundAmount, escrow.getRefundedAmount(), escrow.getCommissionAmount(),
                escrow.getNetAmount(), escrow.getStatus());
        return adjustment;
    }

    /**
     * Checks that a refund can still be booked on the escrow of a sub-order.
     *
     * @throws StateConflictException if the escrow was released or lacks the balance
     */
    public void validateRefundable(@NotNull UUID subOrderId, @NotNull BigDecimal refundAmount) {
        escrowTransactionRepository.findBySubOrderId(subOrderId)
                .ifPresent(escrow -> checkRefundable(escrow, refundAmount));
    }

    /**
     * Releases the escrow of a delivered sub-order to the seller.
     *
     * @throws StateConflictException if the sub-order is not delivered or the escrow is closed
     */
    @Transactional
    public EscrowTransaction releaseEscrow(@NotNull UUID escrowTransactionId) {
        EscrowTransaction escrow = escrowTransactionRepository.findById(escrowTransactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Escrow transaction", escrowTransactionId));
        SellerSubOrder subOrder = subOrderRepository.findById(escrow.getSubOrderId())
                .orElseThrow(() -> new ResourceNotFoundException("Sub-order", escrow.getSubOrderId()));

        if (subOrder.getStatus() != OrderStatus.DELIVERED) {
            throw new StateConflictException(String.format(
                    "Escrow %s can only be released after delivery, sub-order is %s",
                    escrowTransactionId, subOrder.getStatus()));
        }
        if (!escrow.isRefundable()) {
            throw new StateConflictException(String.format(
                    "Escrow %s is %s and cannot be released", escrowTransactionId, escrow.getStatus()));
        }

        escrow.release();
        escrowTransactionRepository.save(escrow);
        log.info("Released escrow {} to store {}: net {}", escrowTransactionId, escrow.getStoreId(), escrow.getNetAmount());
        return escrow;
    }

    public Optional<EscrowTransaction> findBySubOrder(@NotNull UUID subOrderId) {
        return escrowTransactionRepository.findBySubOrderId(subOrderId);
    }

    private EscrowTransaction createEscrow(Order order, SellerSubOrder subOrder) {
        BigDecimal gross = subOrder.getTotalAmount();
        Long categoryId = sharedCategory(subOrder.getId());
        CommissionCalculation commission = commissionRuleResolver.resolve(gross, subOrder.getStoreId(), categoryId);

        EscrowTransaction escrow = new EscrowTransaction();
        escrow.setSubOrderId(subOrder.getId());
        escrow.setOrderId(order.getId());
        escrow.setStoreId(subOrder.getStoreId());
        escrow.setGrossAmount(gross);
        escrow.setOriginalCommissionAmount(commission.commissionAmount());
        escrow.setCommissionAmount(commission.commissionAmount());
        escrow.setRefundedAmount(BigDecimal.ZERO);
        escrow.setNetAmount(gross.subtract(commission.commissionAmount()));
        escrow.setStatus(EscrowStatus.HELD);
        escrow.setCreatedAt(LocalDateTime.now());
        escrow = escrowTransactionRepository.save(escrow);

        commissionLedgerService.recordTransaction(
                escrow.getId(),
                subOrder.getStoreId(),
                commission.appliedCategoryId(),
                CommissionTransactionType.INITIAL,
                gross,
                commission.commissionAmount(),
                commission.commissionPercentage(),
                commission.fixedCommissionAmount(),
                commission.source(),
                "Commission for sub-order " + subOrder.getSubOrderNumber());

        log.info("Created escrow {} for sub-order {}: gross {}, commission {}, net {}",
                escrow.getId(), subOrder.getId(), gross, commission.commissionAmount(), escrow.getNetAmount());
        return escrow;
    }

    private Long sharedCategory(UUID subOrderId) {
        Set<Long> categories = orderItemRepository.findBySubOrderIdOrderByIdAsc(subOrderId).stream()
                .map(OrderItem::getCategoryId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return categories.size() == 1 ? categories.iterator().next() : null;
    }

    private void checkRefundable(EscrowTransaction escrow, BigDecimal refundAmount) {
        if (escrow.getStatus() == EscrowStatus.RELEASED) {
            throw new StateConflictException(String.format(
                    "Escrow %s has already been released to the seller", escrow.getId()));
        }
        BigDecimal available = escrow.getGrossAmount().subtract(escrow.getRefundedAmount());
        if (refundAmount.compareTo(available) > 0) {
            throw new StateConflictException(String.format(
                    "Refund %s exceeds escrow balance %s of escrow %s", refundAmount, available, escrow.getId()));
        }
    }
}
