package com.nosota.mercato.service;

import com.nosota.mercato.api.dto.RefundTransactionDTO;
import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
import com.nosota.mercato.api.model.RefundInitiator;
import com.nosota.mercato.api.model.RefundStatus;
import com.nosota.mercato.api.model.RefundType;
import com.nosota.mercato.api.request.FullRefundRequest;
import com.nosota.mercato.api.request.PartialRefundRequest;
import com.nosota.mercato.dto.RefundTransactionMapper;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.PaymentProviderException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.RefundTransaction;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.provider.PaymentProvider;
import com.nosota.mercato.provider.ProviderRefundResult;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.RefundTransactionRepository;
import com.nosota.mercato.repository.SellerSubOrderRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Service for refund operations (money returned to the buyer).
 *
 * <p>Refund workflow:
 * <pre>
 * 1. Lock sub-order(s) and order, check eligibility
 * 2. Create RefundTransaction (REQUESTED), refund number doubles as idempotency key
 * 3. Provider reversal call (PROCESSING)
 *    a. failure   → FAILED with the provider message, nothing else changes
 *    b. success   → sub-order and order refunded totals increased,
 *                   escrow and commission reversed proportionally,
 *                   fully refunded sub-orders moved to REFUNDED → COMPLETED
 * 4. retryFailedRefund repeats only the steps that have not succeeded yet
 * </pre>
 *
 * <p>Key rules:
 * <ul>
 *   <li>Payment must be COMPLETED; NEW, CANCELLED and REFUNDED sub-orders cannot be refunded</li>
 *   <li>Refunded amount of a sub-order never exceeds its total</li>
 *   <li>A released escrow cannot be refunded</li>
 *   <li>Partial refunds leave the sub-order status alone unless they complete the total</li>
 * </ul>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RefundService {

    private static final DateTimeFormatter REFUND_NUMBER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final Set<OrderStatus> NON_REFUNDABLE = Set.of(OrderStatus.NEW, OrderStatus.CANCELLED, OrderStatus.REFUNDED);

    private final RefundTransactionRepository refundTransactionRepository;
    private final OrderRepository orderRepository;
    private final SellerSubOrderRepository subOrderRepository;
    private final OrderLifecycleService orderLifecycleService;
    private final OrderStatusStateMachine stateMachine;
    private final EscrowService escrowService;
    private final PaymentProvider paymentProvider;

    /**
     * Refunds part of one sub-order.
     *
     * @param request Refund request
     * @return The refund, COMPLETED or FAILED
     * @throws InvalidRequestException   if the amount is not positive
     * @throws ResourceNotFoundException if the sub-order does not exist
     * @throws StateConflictException    if the sub-order cannot be refunded by this amount
     */
    @Transactional
    public RefundTransaction processPartialRefund(@Valid @NotNull PartialRefundRequest request) {
        log.info("Processing partial refund of {} for sub-order {}", request.amount(), request.subOrderId());

        // 1. Lock and validate
        SellerSubOrder subOrder = lockSubOrder(request.subOrderId());
        requirePositive(request.amount());
        Order order = lockOrder(subOrder.getOrderId());
        validatePartialRefund(order, subOrder, request.amount());

        // 2. A refund that completes the total must be able to close the sub-order
        if (request.amount().compareTo(subOrder.getRemainingRefundableAmount()) == 0
                && !stateMachine.isTransitionAllowed(subOrder.getStatus(), OrderStatus.REFUNDED)) {
            throw new StateConflictException(String.format(
                    "Sub-order %s is %s and cannot become REFUNDED; cancel it instead of refunding the full amount",
                    subOrder.getId(), subOrder.getStatus()));
        }

        // 3. Record and execute
        RefundTransaction refund = createRefund(order, subOrder, RefundType.PARTIAL, request.amount(),
                request.reason(), request.initiator(), request.initiatedBy(), request.returnRequestId());
        execute(refund, order, true);
        return refund;
    }

    /**
     * Refunds the value of cancelled item units. Unlike a regular partial refund this never
     * closes the sub-order: item fulfillment derives the sub-order status from its items.
     */
    @Transactional
    public RefundTransaction refundCancelledItems(@NotNull UUID subOrderId, @NotNull BigDecimal amount,
                                                  @NotNull String reason, Long initiatedBy) {
        log.info("Processing item cancellation refund of {} for sub-order {}", amount, subOrderId);

        SellerSubOrder subOrder = lockSubOrder(subOrderId);
        requirePositive(amount);
        Order order = lockOrder(subOrder.getOrderId());
        validatePartialRefund(order, subOrder, amount);

        RefundTransaction refund = createRefund(order, subOrder, RefundType.PARTIAL, amount, reason,
                initiatedBy != null ? RefundInitiator.SELLER : RefundInitiator.SYSTEM, initiatedBy, null);
        execute(refund, order, false);
        return refund;
    }

    /**
     * Refunds everything still refundable on an order and closes every active sub-order.
     *
     * @param request Refund request
     * @return The refund, COMPLETED or FAILED
     * @throws ResourceNotFoundException if the order does not exist
     * @throws StateConflictException    if nothing is refundable or an active sub-order cannot become REFUNDED
     */
    @Transactional
    public RefundTransaction processFullRefund(@Valid @NotNull FullRefundRequest request) {
        log.info("Processing full refund for order {}", request.orderId());

        // 1. Lock sub-orders, then the order
        List<SellerSubOrder> subOrders = subOrderRepository.findByOrderIdForUpdate(request.orderId());
        Order order = lockOrder(request.orderId());

        // 2. Every active sub-order must be able to reach REFUNDED
        BigDecimal amount = validateFullRefund(order, subOrders);

        // 3. Record and execute
        RefundTransaction refund = createRefund(order, null, RefundType.FULL, amount,
                request.reason(), request.initiator(), request.initiatedBy(), null);
        execute(refund, order, true);
        return refund;
    }

    /**
     * Retries a FAILED refund with its recorded amount and idempotency key.
     *
     * <p>The provider is called again only if it has not confirmed the reversal yet, and balances
     * are reversed only if that has not happened yet.
     *
     * @param refundId The refund ID
     * @return The refund, COMPLETED or FAILED again
     * @throws ResourceNotFoundException if the refund does not exist
     * @throws StateConflictException    if the refund is not FAILED, or is no longer eligible and the
     *                                   provider has not paid it out yet
     */
    @Transactional
    public RefundTransaction retryFailedRefund(@NotNull UUID refundId) {
        RefundTransaction refund = refundTransactionRepository.findById(refundId)
                .orElseThrow(() -> new ResourceNotFoundException("Refund", refundId));
        if (refund.getStatus() != RefundStatus.FAILED) {
            throw new StateConflictException(String.format(
                    "Refund %s is %s, only FAILED refunds can be retried", refund.getRefundNumber(), refund.getStatus()));
        }

        log.info("Retrying refund {} (attempt {})", refund.getRefundNumber(), refund.getAttemptCount() + 1);

        // Eligibility is checked again under lock before the provider is called
        Order order;
        if (refund.getRefundType() == RefundType.FULL) {
            List<SellerSubOrder> subOrders = subOrderRepository.findByOrderIdForUpdate(refund.getOrderId());
            order = lockOrder(refund.getOrderId());
            if (!refund.isProviderSucceeded()) {
                BigDecimal remaining = validateFullRefund(order, subOrders);
                if (remaining.compareTo(refund.getAmount()) != 0) {
                    throw new StateConflictException(String.format(
                            "Refund %s of %s no longer matches the refundable amount %s of order %s",
                            refund.getRefundNumber(), refund.getAmount(), remaining, order.getId()));
                }
            }
        } else {
            SellerSubOrder subOrder = lockSubOrder(refund.getSubOrderId());
            order = lockOrder(refund.getOrderId());
            if (!refund.isProviderSucceeded()) {
                validatePartialRefund(order, subOrder, refund.getAmount());
            }
        }
        execute(refund, order, true);
        return refund;
    }

    public RefundTransactionDTO getRefund(@NotNull UUID refundId) {
        return RefundTransactionMapper.INSTANCE.toDTO(refundTransactionRepository.findById(refundId)
                .orElseThrow(() -> new ResourceNotFoundException("Refund", refundId)));
    }

    public List<RefundTransactionDTO> getRefundsByOrder(@NotNull UUID orderId) {
        return RefundTransactionMapper.INSTANCE.toDTOList(
                refundTransactionRepository.findByOrderIdOrderByCreatedAtDesc(orderId));
    }

    /**
     * Partial refunds of a store, optionally filtered by status.
     */
    public List<RefundTransactionDTO> getRefundsByStore(@NotNull Long storeId, RefundStatus status) {
        List<RefundTransaction> refunds = status == null
                ? refundTransactionRepository.findByStoreIdOrderByCreatedAtDesc(storeId)
                : refundTransactionRepository.findByStoreIdAndStatusOrderByCreatedAtDesc(storeId, status);
        return RefundTransactionMapper.INSTANCE.toDTOList(refunds);
    }

    /**
     * Amount of COMPLETED refunds of an order.
     */
    public BigDecimal getTotalRefundedAmount(@NotNull UUID orderId) {
        return refundTransactionRepository.sumCompletedAmountByOrderId(orderId);
    }

    private void execute(RefundTransaction refund, Order order, boolean closeFullyRefunded) {
        refund.setStatus(RefundStatus.PROCESSING);
        refund.setAttemptCount(refund.getAttemptCount() + 1);
        refund.setErrorMessage(null);
        refund.setUpdatedAt(LocalDateTime.now());

        if (!refund.isProviderSucceeded()) {
            ProviderRefundResult result;
            try {
                result = paymentProvider.initiateRefund(order.getPaymentReference(), refund.getAmount(),
                        refund.getIdempotencyKey());
            } catch (PaymentProviderException e) {
                log.error("Refund {} provider call failed: {}", refund.getRefundNumber(), e.getMessage(), e);
                markFailed(refund, e.getMessage());
                return;
            }

            if (!result.success()) {
                log.error("Refund {} declined by provider: {}", refund.getRefundNumber(), result.errorMessage());
                markFailed(refund, result.errorMessage());
                return;
            }
            refund.setProviderSucceeded(true);
            refund.setProviderRefundId(result.providerRefundId());
        }

        if (!refund.isFundsReversed()) {
            BigDecimal commissionAdjustment = refund.getRefundType() == RefundType.FULL
                    ? reverseFullRefund(refund, order)
                    : reversePartialRefund(refund, order, closeFullyRefunded);
            refund.setCommissionRefundAmount(commissionAdjustment);
            refund.setFundsReversed(true);
        }

        refund.setStatus(RefundStatus.COMPLETED);
        refund.setCompletedAt(LocalDateTime.now());
        refund.setUpdatedAt(refund.getCompletedAt());
        refundTransactionRepository.save(refund);

        log.info("Refund {} completed: amount {}, commission adjustment {}, provider id {}",
                refund.getRefundNumber(), refund.getAmount(), refund.getCommissionRefundAmount(),
                refund.getProviderRefundId());
    }

    private BigDecimal reversePartialRefund(RefundTransaction refund, Order order, boolean closeFullyRefunded) {
        SellerSubOrder subOrder = lockSubOrder(refund.getSubOrderId());
        if (refund.getAmount().compareTo(subOrder.getRemainingRefundableAmount()) > 0) {
            throw new StateConflictException(String.format(
                    "Refund %s of %s exceeds remaining refundable amount %s of sub-order %s",
                    refund.getRefundNumber(), refund.getAmount(), subOrder.getRemainingRefundableAmount(),
                    subOrder.getId()));
        }

        subOrder.addRefundedAmount(refund.getAmount());
        subOrderRepository.save(subOrder);
        order.addRefundedAmount(refund.getAmount());
        orderRepository.save(order);
        BigDecimal adjustment = escrowService.recordRefund(subOrder.getId(), refund.getAmount());

        if (closeFullyRefunded && subOrder.isFullyRefunded()
                && stateMachine.isTransitionAllowed(subOrder.getStatus(), OrderStatus.REFUNDED)) {
            orderLifecycleService.applyTransition(subOrder, OrderStatus.REFUNDED,
                    "Fully refunded by " + refund.getRefundNumber(), refund.getInitiatedBy());
            orderLifecycleService.recalculateOrderStatus(order.getId());
        }
        return adjustment;
    }

    private BigDecimal reverseFullRefund(RefundTransaction refund, Order order) {
        List<SellerSubOrder> active = subOrderRepository.findByOrderIdForUpdate(order.getId()).stream()
                .filter(s -> !stateMachine.isFinalState(s.getStatus()))
                .toList();
        BigDecimal remaining = remainingOf(active);
        if (remaining.compareTo(refund.getAmount()) != 0) {
            throw new StateConflictException(String.format(
                    "Refund %s of %s no longer matches the refundable amount %s of order %s",
                    refund.getRefundNumber(), refund.getAmount(), remaining, order.getId()));
        }

        BigDecimal totalAdjustment = BigDecimal.ZERO;
        for (SellerSubOrder subOrder : active) {
            BigDecimal subOrderRemaining = subOrder.getRemainingRefundableAmount();
            if (subOrderRemaining.signum() > 0) {
                subOrder.addRefundedAmount(subOrderRemaining);
                subOrderRepository.save(subOrder);
                totalAdjustment = totalAdjustment.add(escrowService.recordRefund(subOrder.getId(), subOrderRemaining));
            }
            orderLifecycleService.applyTransition(subOrder, OrderStatus.REFUNDED,
                    "Order refunded by " + refund.getRefundNumber(), refund.getInitiatedBy());
        }

        order.addRefundedAmount(refund.getAmount());
        order.setPaymentStatus(PaymentStatus.REFUNDED);
        orderRepository.save(order);
        orderLifecycleService.recalculateOrderStatus(order.getId());
        return totalAdjustment;
    }

    private void validatePartialRefund(Order order, SellerSubOrder subOrder, BigDecimal amount) {
        BigDecimal remaining = subOrder.getRemainingRefundableAmount();
        if (remaining.signum() <= 0) {
            throw new StateConflictException(String.format(
                    "No amount available to refund, sub-order %s has been fully refunded", subOrder.getId()));
        }
        if (amount.compareTo(remaining) > 0) {
            throw new StateConflictException(String.format(
                    "Refund amount %s exceeds available refund amount %s of sub-order %s",
                    amount, remaining, subOrder.getId()));
        }

        requireCompletedPayment(order);
        if (NON_REFUNDABLE.contains(subOrder.getStatus())) {
            throw new StateConflictException(String.format(
                    "Sub-order %s is %s and cannot be refunded", subOrder.getId(), subOrder.getStatus()));
        }
        escrowService.validateRefundable(subOrder.getId(), amount);
    }

    /**
     * Checks a full refund of the order and returns the amount left on its active sub-orders.
     */
    private BigDecimal validateFullRefund(Order order, List<SellerSubOrder> subOrders) {
        requireCompletedPayment(order);

        List<SellerSubOrder> active = subOrders.stream()
                .filter(s -> !stateMachine.isFinalState(s.getStatus()))
                .toList();
        if (active.isEmpty()) {
            throw new StateConflictException(String.format("Order %s has no active sub-orders to refund", order.getId()));
        }
        for (SellerSubOrder subOrder : active) {
            if (!stateMachine.isTransitionAllowed(subOrder.getStatus(), OrderStatus.REFUNDED)) {
                throw new StateConflictException(String.format(
                        "Sub-order %s is %s and cannot become REFUNDED", subOrder.getId(), subOrder.getStatus()));
            }
        }

        BigDecimal amount = remainingOf(active);
        if (amount.signum() <= 0) {
            throw new StateConflictException(String.format(
                    "No amount available to refund, order %s has been fully refunded", order.getId()));
        }
        for (SellerSubOrder subOrder : active) {
            if (subOrder.getRemainingRefundableAmount().signum() > 0) {
                escrowService.validateRefundable(subOrder.getId(), subOrder.getRemainingRefundableAmount());
            }
        }
        return amount;
    }

    private RefundTransaction createRefund(Order order, SellerSubOrder subOrder, RefundType type, BigDecimal amount,
                                           String reason, RefundInitiator initiator, Long initiatedBy,
                                           UUID returnRequestId) {
        String refundNumber = generateRefundNumber();
        LocalDateTime now = LocalDateTime.now();

        RefundTransaction refund = new RefundTransaction();
        refund.setRefundNumber(refundNumber);
        refund.setIdempotencyKey(refundNumber);
        refund.setOrderId(order.getId());
        refund.setSubOrderId(subOrder != null ? subOrder.getId() : null);
        refund.setStoreId(subOrder != null ? subOrder.getStoreId() : null);
        refund.setRefundType(type);
        refund.setAmount(amount);
        refund.setCommissionRefundAmount(BigDecimal.ZERO);
        refund.setCurrency(order.getCurrency());
        refund.setStatus(RefundStatus.REQUESTED);
        refund.setInitiator(initiator);
        refund.setInitiatedBy(initiatedBy);
        refund.setReturnRequestId(returnRequestId);
        refund.setReason(reason);
        refund.setAttemptCount(0);
        refund.setCreatedAt(now);
        refund.setUpdatedAt(now);
        refund = refundTransactionRepository.save(refund);

        log.info("Created {} refund {} for order {}, amount {}", type, refundNumber, order.getId(), amount);
        return refund;
    }

    private void markFailed(RefundTransaction refund, String errorMessage) {
        refund.setStatus(RefundStatus.FAILED);
        refund.setErrorMessage(errorMessage != null ? errorMessage : "Unknown payment provider error");
        refund.setUpdatedAt(LocalDateTime.now());
        refundTransactionRepository.save(refund);
    }

    private String generateRefundNumber() {
        String refundNumber;
        do {
            refundNumber = String.format("REF-%s-%04d",
                    LocalDateTime.now().format(REFUND_NUMBER_FORMAT),
                    ThreadLocalRandom.current().nextInt(10000));
        } while (refundTransactionRepository.existsByRefundNumber(refundNumber));
        return refundNumber;
    }

    private void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException("Refund amount must be greater than zero");
        }
    }

    private void requireCompletedPayment(Order order) {
        if (order.getPaymentStatus() != PaymentStatus.COMPLETED) {
            throw new StateConflictException(String.format(
                    "Order %s payment is %s, refunds need a completed payment", order.getId(), order.getPaymentStatus()));
        }
    }

    private static BigDecimal remainingOf(List<SellerSubOrder> subOrders) {
        return subOrders.stream()
                .map(SellerSubOrder::getRemainingRefundableAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private SellerSubOrder lockSubOrder(UUID subOrderId) {
        return subOrderRepository.findByIdForUpdate(subOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("Sub-order", subOrderId));
    }

    private Order lockOrder(UUID orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
