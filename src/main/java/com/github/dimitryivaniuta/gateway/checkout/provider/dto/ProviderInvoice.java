package com.github.dimitryivaniuta.gateway.checkout.provider.dto;

import java.math.BigDecimal;

/**
 * Invoice as reported by the provider.
 *
 * @param id provider invoice id
 * @param externalId our checkout token
 * @param status provider-defined status string (e.g. PENDING, PAID, SETTLED, EXPIRED)
 * @param invoiceUrl hosted checkout page
 * @param amount invoice amount
 * @param currency currency
 * @param rawJson the response body exactly as received
 */
public record ProviderInvoice(
        String id,
        String externalId,
        String status,
        String invoiceUrl,
        BigDecimal amount,
        String currency,
        String rawJson
) {}
