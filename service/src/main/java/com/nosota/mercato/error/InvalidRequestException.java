package com.nosota.mercato.error;

/**
 * Bad input: non-positive amount, inverted period, month out of range.
 * Raised before any mutation is attempted.
 */
public class InvalidRequestException extends MarketplaceException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
