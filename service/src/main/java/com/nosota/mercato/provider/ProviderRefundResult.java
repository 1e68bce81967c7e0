package com.nosota.mercato.provider;

/**
 * Outcome of a provider refund call.
 *
 * @param success          True if the provider accepted the reversal
 * @param providerRefundId Provider's id of the reversal, null on failure
 * @param errorMessage     Provider's reason, null on success
 */
public record ProviderRefundResult(
        boolean success,
        String providerRefundId,
        String errorMessage
) {

    public static ProviderRefundResult succeeded(String providerRefundId) {
        return new ProviderRefundResult(true, providerRefundId, null);
    }

    public static ProviderRefundResult failed(String errorMessage) {
        return new ProviderRefundResult(false, null, errorMessage);
    }
}
