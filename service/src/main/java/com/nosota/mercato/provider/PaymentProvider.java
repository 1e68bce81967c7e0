package com.nosota.mercato.provider;

import java.math.BigDecimal;

/**
 * Opaque payment provider used to return money to the buyer.
 */
public interface PaymentProvider {

    /**
     * Asks the provider to reverse part or all of a captured payment.
     *
     * <p>Repeating a call with the same idempotency key must not move money twice.
     *
     * @param transactionRef Provider reference of the captured payment
     * @param amount         Amount to reverse
     * @param idempotencyKey Stable key for this refund, reused on retries
     * @return Provider outcome; a declined refund is a result, not an exception
     * @throws com.nosota.mercato.error.PaymentProviderException if the provider could not be reached
     */
    ProviderRefundResult initiateRefund(String transactionRef, BigDecimal amount, String idempotencyKey);
}
