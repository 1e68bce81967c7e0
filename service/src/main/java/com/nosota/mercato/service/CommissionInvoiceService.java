package com.nosota.mercato.service;

import com.nosota.mercato.api.dto.CommissionInvoiceDTO;
import com.nosota.mercato.api.model.CommissionInvoiceStatus;
import com.nosota.mercato.api.model.StoreStatus;
import com.nosota.mercato.dto.CommissionInvoiceMapper;
import com.nosota.mercato.error.InvalidRequestException;
import com.nosota.mercato.error.ResourceNotFoundException;
import com.nosota.mercato.error.StateConflictException;
import com.nosota.mercato.model.CommissionInvoice;
import com.nosota.mercato.model.CommissionInvoiceItem;
import com.nosota.mercato.model.CommissionTransaction;
import com.nosota.mercato.model.Store;
import com.nosota.mercato.repository.CommissionInvoiceItemRepository;
import com.nosota.mercato.repository.CommissionInvoiceRepository;
import com.nosota.mercato.repository.StoreRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for commission invoices billed to sellers.
 *
 * <p>Invoice generation is idempotent by period: a live (not CANCELLED or SUPERSEDED) invoice for the
 * exact period is returned unchanged. Corrections are made with credit notes, never by editing.
 *
 * <p>Amounts:
 * <pre>
 * subtotal = Σ commission of the period (refund adjustments included)
 * tax      = round(subtotal * taxPercentage / 100, 2)
 * total    = subtotal + tax
 * </pre>
 *
 * <p>Numbers are {@code INV-{year}-{sequence:000000}}; the sequence continues from the highest
 * existing number of that year.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CommissionInvoiceService {

    private static final EnumSet<CommissionInvoiceStatus> INACTIVE_STATUSES =
            EnumSet.of(CommissionInvoiceStatus.CANCELLED, CommissionInvoiceStatus.SUPERSEDED);

    private final CommissionInvoiceRepository invoiceRepository;
    private final CommissionInvoiceItemRepository invoiceItemRepository;
    private final CommissionLedgerService commissionLedgerService;
    private final StoreRepository storeRepository;
    private final CommissionInvoiceStatusStateMachine stateMachine;
    private final TransactionTemplate transactionTemplate;

    @Value("${invoice.tax-percentage:0}")
    private BigDecimal taxPercentage;

    @Value("${invoice.due-days:30}")
    private int dueDays;

    @Value("${invoice.company-name:Mercato Marketplace}")
    private String companyName;

    @Value("${marketplace.currency:USD}")
    private String currency;

    /**
     * Generates the commission invoice of a store for a period.
     *
     * @param storeId     The store ID
     * @param periodStart First day of the period
     * @param periodEnd   Last day of the period (inclusive)
     * @return The existing live invoice of the period, the new DRAFT invoice, or empty if the
     * period has no commission transactions
     * @throws InvalidRequestException if the period end is before its start
     */
    @Transactional
    public Optional<CommissionInvoice> generateInvoice(@NotNull Long storeId,
                                                       @NotNull LocalDate periodStart,
                                                       @NotNull LocalDate periodEnd) {
        Optional<CommissionInvoice> existing = findLiveInvoice(storeId, periodStart, periodEnd);
        if (existing.isPresent()) {
            log.info("Invoice {} already exists for store {} and period {} - {}",
                    existing.get().getInvoiceNumber(), storeId, periodStart, periodEnd);
            return existing;
        }

        List<CommissionTransaction> transactions =
                commissionLedgerService.findTransactionsByStore(storeId, periodStart, periodEnd);
        if (transactions.isEmpty()) {
            log.info("No commission transactions for store {} in period {} - {}, no invoice generated",
                    storeId, periodStart, periodEnd);
            return Optional.empty();
        }

        BigDecimal subtotal = transactions.stream()
                .map(CommissionTransaction::getCommissionAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal taxAmount = subtotal.multiply(taxPercentage)
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);

        LocalDate issueDate = LocalDate.now();
        CommissionInvoice invoice = new CommissionInvoice();
        invoice.setInvoiceNumber(nextInvoiceNumber(issueDate.getYear()));
        invoice.setStoreId(storeId);
        invoice.setPeriodStart(periodStart);
        invoice.setPeriodEnd(periodEnd);
        invoice.setIssueDate(issueDate);
        invoice.setDueDate(issueDate.plusDays(dueDays));
        invoice.setSubtotal(subtotal);
        invoice.setTaxPercentage(taxPercentage);
        invoice.setTaxAmount(taxAmount);
        invoice.setTotalAmount(subtotal.add(taxAmount));
        invoice.setCurrency(currency);
        invoice.setStatus(CommissionInvoiceStatus.DRAFT);
        invoice.setCreditNote(false);
        invoice.setNotes(String.format("%s commission for %s - %s", companyName, periodStart, periodEnd));
        invoice.setCreatedAt(LocalDateTime.now());
        invoice = invoiceRepository.save(invoice);

        for (CommissionTransaction transaction : transactions) {
            invoiceItemRepository.save(CommissionInvoiceItem.builder()
                    .invoiceId(invoice.getId())
                    .commissionTransactionId(transaction.getId())
                    .description(itemDescription(transaction))
                    .amount(transaction.getCommissionAmount())
                    .build());
        }

        log.info("Generated invoice {} for store {}: {} item(s), subtotal {}, tax {}, total {}",
                invoice.getInvoiceNumber(), storeId, transactions.size(), subtotal, taxAmount,
                invoice.getTotalAmount());
        return Optional.of(invoice);
    }

    /**
     * Generates invoices for every active store for a calendar month, one transaction per store.
     *
     * @return Number of invoices created by this run
     * @throws InvalidRequestException if the month is outside 1..12
     */
    public int generateMonthlyInvoices(int year, int month) {
        if (month < 1 || month > 12) {
            throw new InvalidRequestException("Month must be between 1 and 12, got " + month);
        }
        YearMonth yearMonth = YearMonth.of(year, month);
        LocalDate periodStart = yearMonth.atDay(1);
        LocalDate periodEnd = yearMonth.atEndOfMonth();

        int generated = 0;
        for (Store store : storeRepository.findByStatusOrderByIdAsc(StoreStatus.ACTIVE)) {
            try {
                Boolean created = transactionTemplate.execute(status -> {
                    if (findLiveInvoice(store.getId(), periodStart, periodEnd).isPresent()) {
                        log.info("Store {} already has an invoice for {}, skipping", store.getId(), yearMonth);
                        return false;
                    }
                    return generateInvoice(store.getId(), periodStart, periodEnd).isPresent();
                });
                if (Boolean.TRUE.equals(created)) {
                    generated++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to generate invoice for store {} and period {}", store.getId(), yearMonth, e);
            }
        }

        log.info("Generated {} invoice(s) for {}", generated, yearMonth);
        return generated;
    }

    @Transactional
    public CommissionInvoice issueInvoice(@NotNull UUID invoiceId) {
        return changeStatus(invoiceId, CommissionInvoiceStatus.ISSUED);
    }

    @Transactional
    public CommissionInvoice markInvoiceAsPaid(@NotNull UUID invoiceId) {
        return changeStatus(invoiceId, CommissionInvoiceStatus.PAID);
    }

    /**
     * Cancels a draft or issued invoice.
     *
     * @throws StateConflictException if the invoice is paid or already closed
     */
    @Transactional
    public CommissionInvoice cancelInvoice(@NotNull UUID invoiceId) {
        return changeStatus(invoiceId, CommissionInvoiceStatus.CANCELLED);
    }

    /**
     * Creates a credit note that negates an invoice and supersedes it.
     *
     * <p>The credit note carries the original period, every amount negated and one negated line per
     * original line, referencing the same commission transactions.
     *
     * @param originalInvoiceId Invoice to correct
     * @param reason            Reason recorded in the credit note
     * @return The credit note
     * @throws ResourceNotFoundException if the invoice does not exist
     * @throws StateConflictException    if the invoice is a credit note or cannot be superseded
     */
    @Transactional
    public CommissionInvoice createCreditNote(@NotNull UUID originalInvoiceId, String reason) {
        CommissionInvoice original = lockInvoice(originalInvoiceId);
        if (original.isCreditNote()) {
            throw new StateConflictException(String.format(
                    "Invoice %s is a credit note and cannot be credited", original.getInvoiceNumber()));
        }
        if (original.getStatus() == CommissionInvoiceStatus.SUPERSEDED) {
            throw new StateConflictException(String.format(
                    "Invoice %s has already been superseded", original.getInvoiceNumber()));
        }
        stateMachine.validateTransition(original.getStatus(), CommissionInvoiceStatus.SUPERSEDED);

        LocalDate issueDate = LocalDate.now();
        CommissionInvoice creditNote = new CommissionInvoice();
        creditNote.setInvoiceNumber(nextInvoiceNumber(issueDate.getYear()));
        creditNote.setStoreId(original.getStoreId());
        creditNote.setPeriodStart(original.getPeriodStart());
        creditNote.setPeriodEnd(original.getPeriodEnd());
        creditNote.setIssueDate(issueDate);
        creditNote.setDueDate(issueDate);
        creditNote.setSubtotal(original.getSubtotal().negate());
        creditNote.setTaxPercentage(original.getTaxPercentage());
        creditNote.setTaxAmount(original.getTaxAmount().negate());
        creditNote.setTotalAmount(original.getTotalAmount().negate());
        creditNote.setCurrency(original.getCurrency());
        creditNote.setStatus(CommissionInvoiceStatus.ISSUED);
        creditNote.setCreditNote(true);
        creditNote.setCorrectingInvoiceId(original.getId());
        creditNote.setNotes(String.format("Credit note for invoice %s. Reason: %s", original.getInvoiceNumber(), reason));
        creditNote.setCreatedAt(LocalDateTime.now());
        creditNote = invoiceRepository.save(creditNote);

        for (CommissionInvoiceItem item : invoiceItemRepository.findByInvoiceIdOrderByIdAsc(original.getId())) {
            invoiceItemRepository.save(CommissionInvoiceItem.builder()
                    .invoiceId(creditNote.getId())
                    .commissionTransactionId(item.getCommissionTransactionId())
                    .description("Credit: " + item.getDescription())
                    .amount(item.getAmount().negate())
                    .build());
        }

        original.changeStatus(CommissionInvoiceStatus.SUPERSEDED);
        invoiceRepository.save(original);

        log.info("Created credit note {} for invoice {}: total {}",
                creditNote.getInvoiceNumber(), original.getInvoiceNumber(), creditNote.getTotalAmount());
        return creditNote;
    }

    /**
     * Full invoice aggregate with its line items.
     */
    public CommissionInvoiceDTO getInvoice(@NotNull UUID invoiceId) {
        CommissionInvoice invoice = invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Commission invoice", invoiceId));
        return toDTO(invoice);
    }

    public List<CommissionInvoiceDTO> getInvoices(@NotNull Long storeId, boolean includeSuperseded) {
        List<CommissionInvoice> invoices = includeSuperseded
                ? invoiceRepository.findByStoreIdOrderByPeriodStartDescCreatedAtDesc(storeId)
                : invoiceRepository.findByStoreIdAndStatusNotOrderByPeriodStartDescCreatedAtDesc(
                        storeId, CommissionInvoiceStatus.SUPERSEDED);
        return invoices.stream()
                .map(this::toDTO)
                .toList();
    }

    private CommissionInvoice changeStatus(UUID invoiceId, CommissionInvoiceStatus newStatus) {
        CommissionInvoice invoice = lockInvoice(invoiceId);
        CommissionInvoiceStatus previousStatus = invoice.getStatus();
        stateMachine.validateTransition(previousStatus, newStatus);

        invoice.changeStatus(newStatus);
        invoiceRepository.save(invoice);
        log.info("Invoice {} status changed: {} → {}", invoice.getInvoiceNumber(), previousStatus, newStatus);
        return invoice;
    }

    private Optional<CommissionInvoice> findLiveInvoice(Long storeId, LocalDate periodStart, LocalDate periodEnd) {
        return invoiceRepository.findFirstByStoreIdAndPeriodStartAndPeriodEndAndCreditNoteFalseAndStatusNotIn(
                storeId, periodStart, periodEnd, INACTIVE_STATUSES);
    }

    String nextInvoiceNumber(int year) {
        String prefix = "INV-" + year + "-";
        int next = invoiceRepository.findFirstByInvoiceNumberStartingWithOrderByInvoiceNumberDesc(prefix)
                .map(last -> Integer.parseInt(last.getInvoiceNumber().substring(prefix.length())) + 1)
                .orElse(1);
        return String.format("%s%06d", prefix, next);
    }

    private CommissionInvoice lockInvoice(UUID invoiceId) {
        return invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Commission invoice", invoiceId));
    }

    private CommissionInvoiceDTO toDTO(CommissionInvoice invoice) {
        return CommissionInvoiceMapper.INSTANCE.toDTO(invoice,
                invoiceItemRepository.findByInvoiceIdOrderByIdAsc(invoice.getId()));
    }

    private static String itemDescription(CommissionTransaction transaction) {
        if (transaction.getNotes() != null) {
            return transaction.getNotes();
        }
        return String.format("%s commission on %s", transaction.getTransactionType(), transaction.getGrossAmount());
    }
}
