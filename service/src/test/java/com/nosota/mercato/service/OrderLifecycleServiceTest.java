package com.nosota.mercato.service;

import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.PaymentStatus;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.OrderStatusHistory;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.repository.OrderRepository;
import com.nosota.mercato.repository.OrderStatusHistoryRepository;
import com.nosota.mercato.repository.SellerSubOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Order lifecycle")
class OrderLifecycleServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private SellerSubOrderRepository subOrderRepository;

    @Mock
    private OrderStatusHistoryRepository historyRepository;

    private OrderLifecycleService lifecycleService;

    private Order order;

    private SellerSubOrder first;

    private SellerSubOrder second;

    @BeforeEach
    void setUp() {
        lifecycleService = new OrderLifecycleService(orderRepository, subOrderRepository, historyRepository,
                new OrderStatusStateMachine());

        order = new Order();
        order.setId(UUID.randomUUID());
        order.setStatus(OrderStatus.NEW);
        order.setPaymentStatus(PaymentStatus.PENDING);
        order.setRefundedAmount(BigDecimal.ZERO);

        first = subOrder(OrderStatus.NEW);
        second = subOrder(OrderStatus.NEW);

        lenient().when(orderRepository.findByIdForUpdate(order.getId())).thenReturn(Optional.of(order));
        lenient().when(subOrderRepository.findByOrderId(order.getId())).thenReturn(List.of(first, second));
        lenient().when(subOrderRepository.findByIdForUpdate(first.getId())).thenReturn(Optional.of(first));
    }

    @Test
    @DisplayName("Payment moves every NEW sub-order and the order to PAID")
    void markOrderAsPaid() {
        when(subOrderRepository.findByOrderIdForUpdate(order.getId())).thenReturn(List.of(first, second));

        lifecycleService.markOrderAsPaid(order.getId(), "pi_42");

        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(order.getPaymentReference()).isEqualTo("pi_42");
        assertThat(order.getPaidAt()).isNotNull();
        assertThat(first.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(second.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        verify(historyRepository, times(2)).save(any(OrderStatusHistory.class));
    }

    @Test
    @DisplayName("Paying an already paid order changes nothing")
    void markOrderAsPaidTwice() {
        order.setPaymentStatus(PaymentStatus.COMPLETED);
        when(subOrderRepository.findByOrderIdForUpdate(order.getId())).thenReturn(List.of(first, second));

        lifecycleService.markOrderAsPaid(order.getId(), "pi_42");

        assertThat(first.getStatus()).isEqualTo(OrderStatus.NEW);
        verify(historyRepository, never()).save(any());
    }

    @Test
    @DisplayName("Refunded order cannot be paid again")
    void markRefundedOrderAsPaid() {
        order.setPaymentStatus(PaymentStatus.REFUNDED);
        when(subOrderRepository.findByOrderIdForUpdate(order.getId())).thenReturn(List.of(first, second));

        assertThatThrownBy(() -> lifecycleService.markOrderAsPaid(order.getId(), "pi_42"))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    @DisplayName("Valid transition writes one history record and rolls up the order")
    void validTransition() {
        first.setStatus(OrderStatus.PAID);
        second.setStatus(OrderStatus.PAID);

        lifecycleService.markPreparing(first.getId(), 5L);

        ArgumentCaptor<OrderStatusHistory> captor = ArgumentCaptor.forClass(OrderStatusHistory.class);
        verify(historyRepository).save(captor.capture());
        assertThat(captor.getValue().getPreviousStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(captor.getValue().getNewStatus()).isEqualTo(OrderStatus.PREPARING);
        assertThat(captor.getValue().getChangedBy()).isEqualTo(5L);
        assertThat(first.getStatus()).isEqualTo(OrderStatus.PREPARING);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PREPARING);
    }

    @Test
    @DisplayName("Invalid transition is rejected without mutation")
    void invalidTransition() {
        first.setStatus(OrderStatus.PAID);

        assertThatThrownBy(() -> lifecycleService.markDelivered(first.getId(), 5L))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("PAID → DELIVERED");

        assertThat(first.getStatus()).isEqualTo(OrderStatus.PAID);
        verify(historyRepository, never()).save(any());
        verify(subOrderRepository, never()).save(any());
    }

    @Test
    @DisplayName("REFUNDED cannot be set through the generic transition")
    void transitionToRefunded() {
        first.setStatus(OrderStatus.DELIVERED);

        assertThatThrownBy(() -> lifecycleService.transition(first.getId(), OrderStatus.REFUNDED, "Refunded", 5L))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("RefundService");

        assertThat(first.getStatus()).isEqualTo(OrderStatus.DELIVERED);
        verify(historyRepository, never()).save(any());
        verify(subOrderRepository, never()).save(any());
    }

    @Test
    @DisplayName("Transition to the current status is a no-op")
    void sameStatus() {
        first.setStatus(OrderStatus.PAID);

        lifecycleService.transition(first.getId(), OrderStatus.PAID, null, null);

        verify(historyRepository, never()).save(any());
        verify(orderRepository, never()).save(any());
    }

    @Test
    @DisplayName("Shipping stores tracking information")
    void markShipped() {
        first.setStatus(OrderStatus.PREPARING);

        lifecycleService.markShipped(first.getId(), "1Z999", "UPS", "https://track/1Z999", 5L);

        assertThat(first.getStatus()).isEqualTo(OrderStatus.SHIPPED);
        assertThat(first.getTrackingNumber()).isEqualTo("1Z999");
        assertThat(first.getCarrierName()).isEqualTo("UPS");
        ArgumentCaptor<OrderStatusHistory> captor = ArgumentCaptor.forClass(OrderStatusHistory.class);
        verify(historyRepository).save(captor.capture());
        assertThat(captor.getValue().getNotes()).contains("1Z999");
    }

    @Test
    @DisplayName("Shipping before preparing is rejected and keeps tracking empty")
    void markShippedTooEarly() {
        first.setStatus(OrderStatus.PAID);

        assertThatThrownBy(() -> lifecycleService.markShipped(first.getId(), "1Z999", "UPS", null, 5L))
                .isInstanceOf(StateConflictException.class);
        assertThat(first.getTrackingNumber()).isNull();
    }

    @Test
    @DisplayName("Tracking update keeps the status and records it in history")
    void updateTracking() {
        first.setStatus(OrderStatus.SHIPPED);

        lifecycleService.updateTrackingInformation(first.getId(), "RR123", "DHL", null, 5L);

        assertThat(first.getTrackingNumber()).isEqualTo("RR123");
        ArgumentCaptor<OrderStatusHistory> captor = ArgumentCaptor.forClass(OrderStatusHistory.class);
        verify(historyRepository).save(captor.capture());
        assertThat(captor.getValue().getPreviousStatus()).isEqualTo(OrderStatus.SHIPPED);
        assertThat(captor.getValue().getNewStatus()).isEqualTo(OrderStatus.SHIPPED);
    }

    @Test
    @DisplayName("Tracking cannot be set on an unshipped sub-order")
    void updateTrackingTooEarly() {
        first.setStatus(OrderStatus.PREPARING);

        assertThatThrownBy(() -> lifecycleService.updateTrackingInformation(first.getId(), "RR123", "DHL", null, 5L))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    @DisplayName("Order status follows the most advanced active sub-order")
    void recalculate() {
        first.setStatus(OrderStatus.DELIVERED);
        second.setStatus(OrderStatus.CANCELLED);

        assertThat(lifecycleService.recalculateOrderStatus(order.getId())).isEqualTo(OrderStatus.DELIVERED);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERED);
        verify(orderRepository).save(order);
    }

    @Test
    @DisplayName("History of an unknown sub-order is not found")
    void historyOfUnknownSubOrder() {
        UUID unknown = UUID.randomUUID();
        when(subOrderRepository.existsById(unknown)).thenReturn(false);

        assertThatThrownBy(() -> lifecycleService.getStatusHistory(unknown))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private SellerSubOrder subOrder(OrderStatus status) {
        SellerSubOrder subOrder = new SellerSubOrder();
        subOrder.setId(UUID.randomUUID());
        subOrder.setOrderId(order.getId());
        subOrder.setStoreId(7L);
        subOrder.setStatus(status);
        subOrder.setTotalAmount(new BigDecimal("100.00"));
        subOrder.setRefundedAmount(BigDecimal.ZERO);
        return subOrder;
    }
}
