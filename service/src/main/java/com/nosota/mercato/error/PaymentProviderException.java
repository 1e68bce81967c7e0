package com.nosota.mercato.error;

/**
 * Failure reported by, or while talking to, the payment provider.
 * Refunds catch it and persist the message on a FAILED refund.
 */
public class PaymentProviderException extends MarketplaceException {
    public PaymentProviderException(String message) {
        super(message);
    }

    public PaymentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
