package com.nosota.mercato.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for the payment provider.
 *
 * <p>Accepts every refund unless {@code payment-provider.mock.fail-refunds} is set, and
 * answers repeated idempotency keys with the first successful result.
 */
@Component
@Slf4j
public class MockPaymentProvider implements PaymentProvider {

    private final Map<String, ProviderRefundResult> completedRefunds = new ConcurrentHashMap<>();

    @Value("${payment-provider.mock.fail-refunds:false}")
    private boolean failRefunds;

    @Override
    public ProviderRefundResult initiateRefund(String transactionRef, BigDecimal amount, String idempotencyKey) {
        ProviderRefundResult previous = completedRefunds.get(idempotencyKey);
        if (previous != null) {
            log.info("Mock provider: replaying refund {} for key {}", previous.providerRefundId(), idempotencyKey);
            return previous;
        }

        if (failRefunds) {
            log.warn("Mock provider: declining refund of {} on payment {}", amount, transactionRef);
            return ProviderRefundResult.failed("Refund declined by mock provider");
        }

        ProviderRefundResult result = ProviderRefundResult.succeeded("mock_re_" + UUID.randomUUID());
        completedRefunds.put(idempotencyKey, result);
        log.info("Mock provider: refunded {} on payment {} as {}", amount, transactionRef, result.providerRefundId());
        return result;
    }

    public void setFailRefunds(boolean failRefunds) {
        this.failRefunds = failRefunds;
    }
}
