package com.nosota.mercato.service;

import com.nosota.mercato.api.model.CommissionSource;
import com.nosota.mercato.api.model.CommissionTransactionType;
import com.nosota.mercato.api.model.EscrowStatus;
import com.nosota.mercato.api.model.OrderItemStatus;
import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
import com.nosota.mercato.dto.CommissionCalculation;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.EscrowTransaction;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.OrderItem;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.repository.EscrowTransactionRepository;
import com.nosota.mercato.repository.OrderItemRepository;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.SellerSubOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Escrow bookkeeping")
class EscrowServiceTest {

    private static final Long STORE_ID = 7L;

    @Mock
    private EscrowTransactionRepository escrowTransactionRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private SellerSubOrderRepository subOrderRepository;

    @Mock
    private OrderItemRepository orderItemRepository;

    @Mock
    private CommissionRuleResolver commissionRuleResolver;

    @Mock
    private CommissionLedgerService commissionLedgerService;

    private EscrowService escrowService;

    private Order order;

    @BeforeEach
    void setUp() {
        escrowService = new EscrowService(escrowTransactionRepository, orderRepository, subOrderRepository,
                orderItemRepository, commissionRuleResolver, commissionLedgerService);

        order = new Order();
        order.setId(UUID.randomUUID());
        order.setPaymentStatus(PaymentStatus.COMPLETED);
    }

    @Test
    @DisplayName("Paid order gets one HELD escrow per sub-order and an INITIAL commission record")
    void createAllocations() {
        SellerSubOrder existingSubOrder = subOrder(new BigDecimal("80.00"), OrderStatus.PAID);
        SellerSubOrder newSubOrder = subOrder(new BigDecimal("200.00"), OrderStatus.PAID);
        EscrowTransaction existing = escrow(existingSubOrder, new BigDecimal("80.00"), new BigDecimal("8.00"));

        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
        when(subOrderRepository.findByOrderId(order.getId())).thenReturn(List.of(existingSubOrder, newSubOrder));
        when(escrowTransactionRepository.findBySubOrderId(existingSubOrder.getId())).thenReturn(Optional.of(existing));
        when(escrowTransactionRepository.findBySubOrderId(newSubOrder.getId())).thenReturn(Optional.empty());
        when(orderItemRepository.findBySubOrderIdOrderByIdAsc(newSubOrder.getId()))
                .thenReturn(List.of(item(newSubOrder.getId(), 3L), item(newSubOrder.getId(), 3L)));
        when(commissionRuleResolver.resolve(new BigDecimal("200.00"), STORE_ID, 3L))
                .thenReturn(CommissionCalculation.builder()
                        .commissionAmount(new BigDecimal("20.00"))
                        .commissionPercentage(BigDecimal.TEN)
                        .fixedCommissionAmount(BigDecimal.ZERO)
                        .source(CommissionSource.CATEGORY)
                        .appliedCategoryId(3L)
                        .build());
        when(escrowTransactionRepository.save(any(EscrowTransaction.class))).thenAnswer(inv -> {
            EscrowTransaction escrow = inv.getArgument(0);
            escrow.setId(UUID.randomUUID());
            return escrow;
        });

        List<EscrowTransaction> escrows = escrowService.createEscrowAllocations(order.getId());

        assertThat(escrows).hasSize(2);
        assertThat(escrows.get(0)).isSameAs(existing);
        EscrowTransaction created = escrows.get(1);
        assertThat(created.getStatus()).isEqualTo(EscrowStatus.HELD);
        assertThat(created.getCommissionAmount()).isEqualByComparingTo("20.00");
        assertThat(created.getOriginalCommissionAmount()).isEqualByComparingTo("20.00");
        assertThat(created.getNetAmount()).isEqualByComparingTo("180.00");
        verify(commissionLedgerService).recordTransaction(eq(created.getId()), eq(STORE_ID), eq(3L),
                eq(CommissionTransactionType.INITIAL), eq(new BigDecimal("200.00")), eq(new BigDecimal("20.00")),
                eq(BigDecimal.TEN), eq(BigDecimal.ZERO), eq(CommissionSource.CATEGORY), anyString());
    }

    @Test
    @DisplayName("Mixed item categories resolve without a category")
    void mixedCategories() {
        SellerSubOrder subOrder = subOrder(new BigDecimal("50.00"), OrderStatus.PAID);
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
        when(subOrderRepository.findByOrderId(order.getId())).thenReturn(List.of(subOrder));
        when(escrowTransactionRepository.findBySubOrderId(subOrder.getId())).thenReturn(Optional.empty());
        when(orderItemRepository.findBySubOrderIdOrderByIdAsc(subOrder.getId()))
                .thenReturn(List.of(item(subOrder.getId(), 3L), item(subOrder.getId(), 4L)));
        when(commissionRuleResolver.resolve(new BigDecimal("50.00"), STORE_ID, null))
                .thenReturn(CommissionCalculation.builder()
                        .commissionAmount(new BigDecimal("5.00"))
                        .commissionPercentage(BigDecimal.TEN)
                        .fixedCommissionAmount(BigDecimal.ZERO)
                        .source(CommissionSource.GLOBAL)
                        .build());
        when(escrowTransactionRepository.save(any(EscrowTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(escrowService.createEscrowAllocations(order.getId()))
                .singleElement()
                .satisfies(escrow -> assertThat(escrow.getNetAmount()).isEqualByComparingTo("45.00"));
    }

    @Test
    @DisplayName("Escrow needs a completed payment")
    void unpaidOrder() {
        order.setPaymentStatus(PaymentStatus.PENDING);
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> escrowService.createEscrowAllocations(order.getId()))
                .isInstanceOf(StateConflictException.class);
        verify(escrowTransactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Refund reduces commission and net proportionally")
    void recordRefund() {
        SellerSubOrder subOrder = subOrder(new BigDecimal("200.00"), OrderStatus.SHIPPED);
        EscrowTransaction escrow = escrow(subOrder, new BigDecimal("200.00"), new BigDecimal("20.00"));
        when(escrowTransactionRepository.findBySubOrderId(subOrder.getId())).thenReturn(Optional.of(escrow));
        when(commissionLedgerService.recalculateForRefund(escrow.getId(), new BigDecimal("60.00"), new BigDecimal("20.00")))
                .thenReturn(new BigDecimal("-6.00"));

        BigDecimal adjustment = escrowService.recordRefund(subOrder.getId(), new BigDecimal("60.00"));

        assertThat(adjustment).isEqualByComparingTo("-6.00");
        assertThat(escrow.getRefundedAmount()).isEqualByComparingTo("60.00");
        assertThat(escrow.getCommissionAmount()).isEqualByComparingTo("14.00");
        assertThat(escrow.getNetAmount()).isEqualByComparingTo("126.00");
        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.PARTIALLY_REFUNDED);
    }

    @Test
    @DisplayName("Refund of the full gross returns the escrow to the buyer")
    void fullRefundReturnsToBuyer() {
        SellerSubOrder subOrder = subOrder(new BigDecimal("200.00"), OrderStatus.SHIPPED);
        EscrowTransaction escrow = escrow(subOrder, new BigDecimal("200.00"), new BigDecimal("20.00"));
        when(escrowTransactionRepository.findBySubOrderId(subOrder.getId())).thenReturn(Optional.of(escrow));
        when(commissionLedgerService.recalculateForRefund(any(), any(), any())).thenReturn(new BigDecimal("-20.00"));

        escrowService.recordRefund(subOrder.getId(), new BigDecimal("200.00"));

        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.RETURNED_TO_BUYER);
        assertThat(escrow.getNetAmount()).isEqualByComparingTo("0");
        assertThat(escrow.getReturnedToBuyerAt()).isNotNull();
    }

    @Test
    @DisplayName("Released escrow cannot be refunded")
    void releasedEscrow() {
        SellerSubOrder subOrder = subOrder(new BigDecimal("200.00"), OrderStatus.DELIVERED);
        EscrowTransaction escrow = escrow(subOrder, new BigDecimal("200.00"), new BigDecimal("20.00"));
        escrow.release();
        when(escrowTransactionRepository.findBySubOrderId(subOrder.getId())).thenReturn(Optional.of(escrow));

        assertThatThrownBy(() -> escrowService.recordRefund(subOrder.getId(), new BigDecimal("10.00")))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("released");
        verify(commissionLedgerService, never()).recalculateForRefund(any(), any(), any());
    }

    @Test
    @DisplayName("Sub-order without escrow books the refund with zero commission reversal")
    void noEscrow() {
        UUID subOrderId = UUID.randomUUID();
        when(escrowTransactionRepository.findBySubOrderId(subOrderId)).thenReturn(Optional.empty());

        assertThat(escrowService.recordRefund(subOrderId, new BigDecimal("10.00"))).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Escrow is released only after delivery")
    void release() {
        SellerSubOrder subOrder = subOrder(new BigDecimal("200.00"), OrderStatus.SHIPPED);
        EscrowTransaction escrow = escrow(subOrder, new BigDecimal("200.00"), new BigDecimal("20.00"));
        when(escrowTransactionRepository.findById(escrow.getId())).thenReturn(Optional.of(escrow));
        when(subOrderRepository.findById(subOrder.getId())).thenReturn(Optional.of(subOrder));

        assertThatThrownBy(() -> escrowService.releaseEscrow(escrow.getId()))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("after delivery");

        subOrder.setStatus(OrderStatus.DELIVERED);
        EscrowTransaction released = escrowService.releaseEscrow(escrow.getId());

        assertThat(released.getStatus()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(released.getReleasedAt()).isNotNull();
    }

    private SellerSubOrder subOrder(BigDecimal total, OrderStatus status) {
        SellerSubOrder subOrder = new SellerSubOrder();
        subOrder.setId(UUID.randomUUID());
        subOrder.setOrderId(order.getId());
        subOrder.setStoreId(STORE_ID);
        subOrder.setSubOrderNumber("SUB-" + total);
        subOrder.setStatus(status);
        subOrder.setTotalAmount(total);
        subOrder.setRefundedAmount(BigDecimal.ZERO);
        return subOrder;
    }

    private EscrowTransaction escrow(SellerSubOrder subOrder, BigDecimal gross, BigDecimal commission) {
        EscrowTransaction escrow = new EscrowTransaction();
        escrow.setId(UUID.randomUUID());
        escrow.setSubOrderId(subOrder.getId());
        escrow.setOrderId(order.getId());
        escrow.setStoreId(STORE_ID);
        escrow.setGrossAmount(gross);
        escrow.setOriginalCommissionAmount(commission);
        escrow.setCommissionAmount(commission);
        escrow.setRefundedAmount(BigDecimal.ZERO);
        escrow.setNetAmount(gross.subtract(commission));
        escrow.setStatus(EscrowStatus.HELD);
        escrow.setCreatedAt(LocalDateTime.now());
        return escrow;
    }

    private static OrderItem item(UUID subOrderId, Long categoryId) {
        OrderItem item = new OrderItem();
        item.setId(UUID.randomUUID());
        item.setSubOrderId(subOrderId);
        item.setCategoryId(categoryId);
        item.setStatus(OrderItemStatus.NEW);
        return item;
    }
}
