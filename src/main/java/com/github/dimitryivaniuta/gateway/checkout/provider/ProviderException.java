package com.github.dimitryivaniuta.gateway.checkout.provider;

import lombok.Getter;

/**
 * Failure talking to the invoice provider.
 */
@Getter
public class ProviderException extends RuntimeException {

    /**
     * Failure class, so callers can branch without parsing messages.
     */
    public enum Kind {
        /** Connection refused, timeout or a 5xx answer. */
        UNAVAILABLE,
        /** API key missing, wrong or lacking permission. */
        AUTHENTICATION,
        /** Provider refused the request payload. */
        REJECTED,
        /** The requested invoice does not exist on the provider side. */
        NOT_FOUND,
        /** The answer could not be understood. */
        UNEXPECTED_RESPONSE
    }

    private final Kind kind;
    private final Integer httpStatus;

    public ProviderException(Kind kind, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public ProviderException(Kind kind, String message) {
        this(kind, message, null, null);
    }
}
