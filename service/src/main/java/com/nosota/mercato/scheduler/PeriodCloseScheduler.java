package com.nosota.mercato.scheduler;

import com.nosota.mercato.service.CommissionInvoiceService;
import com.nosota.mercato.service.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.YearMonth;

/**
 * Scheduled job closing the previous month.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Generate settlements of all active stores for the previous month</li>
 *   <li>Generate commission invoices of all active stores for the previous month</li>
 * </ul>
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   period-close:
 *     enabled: true               # enable/disable scheduler
 *     cron: "0 0 2 1 * *"         # 02:00 on the first day of each month
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.period-close.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PeriodCloseScheduler {

    private final SettlementService settlementService;
    private final CommissionInvoiceService commissionInvoiceService;

    @Scheduled(cron = "${scheduler.period-close.cron:0 0 2 1 * *}")
    public void closePreviousMonth() {
        YearMonth period = YearMonth.now().minusMonths(1);
        log.info("Starting scheduled job: period close for {}", period);

        try {
            int settlements = settlementService.generateMonthlySettlements(period.getYear(), period.getMonthValue());
            log.info("Generated {} settlement(s) for {}", settlements, period);
        } catch (Exception e) {
            log.error("Failed to generate settlements for {}: {}", period, e.getMessage(), e);
        }

        try {
            int invoices = commissionInvoiceService.generateMonthlyInvoices(period.getYear(), period.getMonthValue());
            log.info("Generated {} commission invoice(s) for {}", invoices, period);
        } catch (Exception e) {
            log.error("Failed to generate commission invoices for {}: {}", period, e.getMessage(), e);
        }
    }
}
