package com.nosota.mercato.api.dto;

import com.nosota.mercato.api.model.CommissionInvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Commission invoice or credit note with its line items.
 *
 * @param id                   Invoice UUID
 * @param invoiceNumber        INV-{year}-{sequence}
 * @param storeId              Billed store
 * @param periodStart          First day of the billed period
 * @param periodEnd            Last day of the billed period (inclusive)
 * @param issueDate            Date of issue
 * @param dueDate              Payment due date
 * @param subtotal             Sum of commission
 * @param taxPercentage        Tax rate applied
 * @param taxAmount            subtotal * taxPercentage / 100
 * @param totalAmount          subtotal + taxAmount
 * @param currency             ISO 4217 code
 * @param status               Current status
 * @param creditNote           True for a negated correcting document
 * @param correctingInvoiceId  Invoice corrected by this credit note
 * @param notes                Free text
 * @param items                One line per billed commission transaction
 */
public record CommissionInvoiceDTO(
        UUID id,
        String invoiceNumber,
        Long storeId,
        LocalDate periodStart,
        LocalDate periodEnd,
        LocalDate issueDate,
        LocalDate dueDate,
        BigDecimal subtotal,
        BigDecimal taxPercentage,
        BigDecimal taxAmount,
        BigDecimal totalAmount,
        String currency,
        CommissionInvoiceStatus status,
        boolean creditNote,
        UUID correctingInvoiceId,
        String notes,
        LocalDateTime paidAt,
        LocalDateTime cancelledAt,
        List<CommissionInvoiceItemDTO> items
) {
}
