package com.github.dimitryivaniuta.gateway.checkout.web.dto;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutToken;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted checkout record, exposed for audit.
 */
public record CheckoutTokenResponse(
        String token,
        String providerInvoiceId,
        String status,
        String rawOutput,
        String referenceType,
        String referenceId,
        BigDecimal amount,
        String currency,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {
    /**
     * Maps a {@link CheckoutToken} to an API response.
     *
     * @param t token entity
     * @return response
     */
    public static CheckoutTokenResponse from(CheckoutToken t) {
        return new CheckoutTokenResponse(
                t.getToken(),
                t.getProviderInvoiceId(),
                t.getStatus().name(),
                t.getRawOutput(),
                t.getReferenceType(),
                t.getReferenceId(),
                t.getAmount(),
                t.getCurrency(),
                t.getCreatedAt(),
                t.getUpdatedAt(),
                t.getCompletedAt()
        );
    }
}
