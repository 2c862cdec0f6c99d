package com.github.dimitryivaniuta.gateway.checkout.service.dto;

/**
 * Outcome of a successful checkout request.
 *
 * @param token checkout token
 * @param invoiceUrl hosted checkout page the payer must be sent to
 * @param providerInvoiceId provider invoice id
 */
public record CheckoutResult(String token, String invoiceUrl, String providerInvoiceId) {}
