package com.nosota.mercato.model;

import com.nosota.mercato.api.model.CommissionInvoiceStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Commission invoice billed to a store for one period, or a credit note correcting one.
 *
 * <p>A credit note carries the negated amounts of the invoice it corrects and links to it
 * through {@code correctingInvoiceId}; the corrected invoice becomes SUPERSEDED.
 */
@Entity
@Table(name = "commission_invoice")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CommissionInvoice {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * INV-{year}-{sequence:000000}, unique across all invoices and credit notes.
     */
    @Column(name = "invoice_number", nullable = false, unique = true, length = 30)
    private String invoiceNumber;

    @Column(name = "store_id", nullable = false)
    private Long storeId;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "issue_date", nullable = false)
    private LocalDate issueDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "subtotal", nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal taxPercentage;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CommissionInvoiceStatus status;

    @Column(name = "credit_note", nullable = false)
    private boolean creditNote;

    @Column(name = "correcting_invoice_id")
    private UUID correctingInvoiceId;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void changeStatus(CommissionInvoiceStatus newStatus) {
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
        if (newStatus == CommissionInvoiceStatus.PAID) {
            this.paidAt = updatedAt;
        } else if (newStatus == CommissionInvoiceStatus.CANCELLED) {
            this.cancelledAt = updatedAt;
        }
    }
}
