package com.github.dimitryivaniuta.gateway.checkout.provider.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.List;

/**
 * Payload for creating a hosted invoice. Serialized as-is (snake_case) into the provider request body.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateInvoiceCommand(
        String externalId,
        String payerEmail,
        String description,
        BigDecimal amount,
        InvoiceCustomer customer,
        boolean shouldSendEmail,
        long invoiceDuration,
        String successRedirectUrl,
        String failureRedirectUrl,
        String currency,
        List<InvoiceFee> fees,
        List<InvoiceItem> items
) {}
