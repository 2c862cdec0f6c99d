package com.github.dimitryivaniuta.gateway.checkout.service.dto;

/**
 * Redirect hints returned by the reference record owner when it is told a payment was authorized.
 *
 * @param redirectTarget replaces the default success page when present (e.g. a document-specific thank-you page)
 * @param redirectTo carried forward as {@code redirect_to} when present
 * @param redirectMessage carried forward as {@code redirect_message} when present
 */
public record PaymentAuthorizationResult(String redirectTarget, String redirectTo, String redirectMessage) {

    /**
     * No hints.
     *
     * @return empty result
     */
    public static PaymentAuthorizationResult none() {
        return new PaymentAuthorizationResult(null, null, null);
    }
}
