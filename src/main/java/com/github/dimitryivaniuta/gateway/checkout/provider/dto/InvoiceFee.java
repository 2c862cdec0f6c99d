package com.github.dimitryivaniuta.gateway.checkout.provider.dto;

/**
 * Fee line charged to the payer on top of the amount.
 *
 * @param type fee type (e.g. GATEWAY)
 * @param value fee in minor units
 */
public record InvoiceFee(String type, long value) {}
