package com.github.dimitryivaniuta.gateway.checkout.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted when a checkout is settled.
 *
 * <p>Stored in the outbox and later published to Kafka.</p>
 */
public record CheckoutCompletedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String token,
        String referenceType,
        String referenceId,
        String providerInvoiceId,
        String providerStatus,
        BigDecimal amount,
        String currency,
        String gateway
) {}
