package com.nosota.mercato.error;

/**
 * Base class of all domain failures raised by the settlement core.
 * Unchecked, so a failure inside a transactional service method rolls the whole operation back.
 */
public class MarketplaceException extends RuntimeException {
    public MarketplaceException() {
    }

    public MarketplaceException(String message) {
        super(message);
    }

    public MarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }

    public MarketplaceException(Throwable cause) {
        super(cause);
    }

    public MarketplaceException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
