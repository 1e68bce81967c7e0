package com.nosota.mercato.tests;

import com.nosota.mercato.TestBase;
import com.nosota.mercato.api.dto.CommissionInvoiceDTO;
import com.nosota.mercato.api.dto.CommissionTransactionDTO;
import com.nosota.mercato.api.dto.OrderStatusHistoryDTO;
import com.nosota.mercato.api.dto.SettlementDTO;
import com.nosota.mercato.api.model.CommissionInvoiceStatus;
import com.nosota.mercato.api.model.EscrowStatus;
import com.nosota.mercato.api.model.OrderStatus;
import com.nosota.mercato.api.model.RefundInitiator;
import com.nosota.mercato.api.model.RefundStatus;
import com.nosota.mercato.api.model.SettlementAdjustmentType;
import com.nosota.mercato.api.model.SettlementStatus;
import com.nosota.mercato.api.request.PartialRefundRequest;
import com.nosota.mercato.api.request.SettlementAdjustmentRequest;
import com.nosota.mercato.model.CommissionInvoice;
import com.nosota.mercato.model.EscrowTransaction;
import com.nosota.mercato.model.Order;
import com.nosota.mercato.model.OrderItem;
import com.nosota.mercato.model.RefundTransaction;
import com.nosota.mercato.model.SellerSubOrder;
import com.nosota.mercato.model.Settlement;
import com.nosota.mercato.model.Store;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end money flow against PostgreSQL.
 *
 * <ul>
 *   <li>FLOW-001: Two partial refunds drain a sub-order and reverse its commission</li>
 *   <li>FLOW-002: Period close produces a settlement and a commission invoice</li>
 *   <li>FLOW-003: Item cancellation refunds flow into the escrow</li>
 * </ul>
 */
@DisplayName("Settlement flow")
public class SettlementFlowTest extends TestBase {

    @Test
    @DisplayName("FLOW-001: Refunds of 60 and 140 on a 200 sub-order at 10%")
    void testPartialRefundsDrainSubOrder() {
        Store store = createStore("Refund store");
        Order order = createOrder(store.getId(), "200.00");
        SellerSubOrder subOrder = subOrderOf(order.getId());
        addItem(subOrder.getId(), 2, "100.00");
        pay(order.getId());

        EscrowTransaction escrow = escrowTransactionRepository.findBySubOrderId(subOrder.getId()).orElseThrow();
        assertThat(escrow.getCommissionAmount()).isEqualByComparingTo("20.00");
        assertThat(escrow.getNetAmount()).isEqualByComparingTo("180.00");

        // Step 1: 60 back to the buyer, 30% of the commission reversed
        RefundTransaction first = refundService.processPartialRefund(new PartialRefundRequest(
                subOrder.getId(), new BigDecimal("60.00"), "Damaged box", RefundInitiator.BUYER, 1L, null));
        assertThat(first.getStatus()).isEqualTo(RefundStatus.COMPLETED);
        assertThat(first.getCommissionRefundAmount()).isEqualByComparingTo("-6.00");

        escrow = escrowTransactionRepository.findBySubOrderId(subOrder.getId()).orElseThrow();
        assertThat(escrow.getRefundedAmount()).isEqualByComparingTo("60.00");
        assertThat(escrow.getCommissionAmount()).isEqualByComparingTo("14.00");
        assertThat(escrow.getNetAmount()).isEqualByComparingTo("126.00");
        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.PARTIALLY_REFUNDED);
        assertThat(subOrderRepository.findById(subOrder.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.PAID);

        // Step 2: the remaining 140 closes the sub-order
        RefundTransaction second = refundService.processPartialRefund(new PartialRefundRequest(
                subOrder.getId(), new BigDecimal("140.00"), "Never arrived", RefundInitiator.BUYER, 1L, null));
        assertThat(second.getStatus()).isEqualTo(RefundStatus.COMPLETED);
        assertThat(second.getCommissionRefundAmount()).isEqualByComparingTo("-14.00");

        escrow = escrowTransactionRepository.findBySubOrderId(subOrder.getId()).orElseThrow();
        assertThat(escrow.getRefundedAmount()).isEqualByComparingTo("200.00");
        assertThat(escrow.getCommissionAmount()).isEqualByComparingTo("0.00");
        assertThat(escrow.getNetAmount()).isEqualByComparingTo("0.00");
        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.RETURNED_TO_BUYER);

        assertThat(subOrderRepository.findById(subOrder.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.REFUNDED);
        Order reloaded = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(reloaded.getRefundedAmount()).isEqualByComparingTo("200.00");
        assertThat(reloaded.getStatus()).isEqualTo(OrderStatus.REFUNDED);
        assertThat(refundService.getTotalRefundedAmount(order.getId())).isEqualByComparingTo("200.00");

        // Ledger: INITIAL + two adjustments net to zero
        List<CommissionTransactionDTO> ledger = commissionLedgerService.getTransactionsByEscrow(escrow.getId());
        assertThat(ledger).hasSize(3);
        assertThat(ledger.stream().map(CommissionTransactionDTO::commissionAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo("0.00");
        assertThat(orderLifecycleService.getStatusHistory(subOrder.getId()))
                .extracting(OrderStatusHistoryDTO::newStatus)
                .containsExactly(OrderStatus.PAID, OrderStatus.REFUNDED);
    }

    @Test
    @DisplayName("FLOW-002: Settlement and invoice of a period with one refund")
    void testPeriodClose() {
        Store store = createStore("Settled store");
        Order order = createOrder(store.getId(), "300.00");
        SellerSubOrder subOrder = subOrderOf(order.getId());
        addItem(subOrder.getId(), 3, "100.00");
        pay(order.getId());
        refundService.processPartialRefund(new PartialRefundRequest(
                subOrder.getId(), new BigDecimal("60.00"), "Late delivery", RefundInitiator.SELLER, 2L, null));

        LocalDateTime periodStart = LocalDateTime.now().minusDays(1);
        LocalDateTime periodEnd = LocalDateTime.now().plusDays(1);

        // Settlement: 300 - 60 - 24
        Settlement settlement = settlementService.generateSettlement(store.getId(), periodStart, periodEnd);
        assertThat(settlement.getGrossSales()).isEqualByComparingTo("300.00");
        assertThat(settlement.getRefunds()).isEqualByComparingTo("60.00");
        assertThat(settlement.getTotalCommission()).isEqualByComparingTo("24.00");
        assertThat(settlement.getNetAmount()).isEqualByComparingTo("216.00");

        settlementService.addAdjustment(settlement.getId(), new SettlementAdjustmentRequest(
                SettlementAdjustmentType.FEE, new BigDecimal("-16.00"), "Return shipping label", null, 9L));
        Settlement regenerated = settlementService.regenerateSettlement(settlement.getId());
        assertThat(regenerated.getVersion()).isEqualTo(2);
        assertThat(regenerated.getNetAmount()).isEqualByComparingTo("200.00");
        settlementService.finalizeSettlement(regenerated.getId());

        List<SettlementDTO> current = settlementService.getSettlements(store.getId(), false);
        assertThat(current).singleElement().satisfies(dto -> {
            assertThat(dto.version()).isEqualTo(2);
            assertThat(dto.status()).isEqualTo(SettlementStatus.FINALIZED);
            assertThat(dto.items()).hasSize(1);
            assertThat(dto.adjustments()).hasSize(1);
        });
        assertThat(settlementService.getSettlements(store.getId(), true)).hasSize(2);

        // Invoice: commission 30 - 6 = 24, plus 10% tax
        LocalDate today = LocalDate.now();
        CommissionInvoice invoice = invoiceService.generateInvoice(store.getId(), today, today).orElseThrow();
        assertThat(invoice.getSubtotal()).isEqualByComparingTo("24.00");
        assertThat(invoice.getTaxAmount()).isEqualByComparingTo("2.40");
        assertThat(invoice.getTotalAmount()).isEqualByComparingTo("26.40");
        assertThat(invoice.getInvoiceNumber()).startsWith("INV-" + today.getYear() + "-");
        assertThat(invoiceService.getInvoice(invoice.getId()).items()).hasSize(2);

        invoiceService.issueInvoice(invoice.getId());
        CommissionInvoice creditNote = invoiceService.createCreditNote(invoice.getId(), "Rate dispute");
        assertThat(creditNote.getTotalAmount()).isEqualByComparingTo("-26.40");
        assertThat(invoiceService.getInvoice(invoice.getId()).status()).isEqualTo(CommissionInvoiceStatus.SUPERSEDED);
        assertThat(invoiceService.getInvoices(store.getId(), false))
                .extracting(CommissionInvoiceDTO::invoiceNumber)
                .containsExactly(creditNote.getInvoiceNumber());
    }

    @Test
    @DisplayName("FLOW-003: Shipping one unit and cancelling the other")
    void testItemCancellationRefund() {
        Store store = createStore("Fulfillment store");
        Order order = createOrder(store.getId(), "100.00");
        SellerSubOrder subOrder = subOrderOf(order.getId());
        OrderItem item = addItem(subOrder.getId(), 2, "50.00");
        pay(order.getId());

        fulfillmentService.shipItemQuantity(item.getId(), 1, 3L);
        assertThat(subOrderRepository.findById(subOrder.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.PREPARING);

        BigDecimal refund = fulfillmentService.cancelItemQuantity(item.getId(), 1, "Out of stock", 3L);
        assertThat(refund).isEqualByComparingTo("50.00");

        assertThat(fulfillmentService.getAvailableQuantity(item.getId())).isZero();
        assertThat(subOrderRepository.findById(subOrder.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.SHIPPED);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.SHIPPED);

        EscrowTransaction escrow = escrowTransactionRepository.findBySubOrderId(subOrder.getId()).orElseThrow();
        assertThat(escrow.getRefundedAmount()).isEqualByComparingTo("50.00");
        assertThat(escrow.getCommissionAmount()).isEqualByComparingTo("5.00");
        assertThat(refundService.getRefundsByOrder(order.getId())).hasSize(1);
    }
}
