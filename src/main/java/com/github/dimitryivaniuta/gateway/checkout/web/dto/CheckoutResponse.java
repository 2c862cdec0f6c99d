package com.github.dimitryivaniuta.gateway.checkout.web.dto;

import com.github.dimitryivaniuta.gateway.checkout.service.dto.CheckoutResult;

/**
 * Response returned for a checkout request.
 *
 * @param token checkout token
 * @param invoiceUrl hosted checkout page to send the payer to
 * @param providerInvoiceId provider invoice id
 */
public record CheckoutResponse(String token, String invoiceUrl, String providerInvoiceId) {

    public static CheckoutResponse from(CheckoutResult r) {
        return new CheckoutResponse(r.token(), r.invoiceUrl(), r.providerInvoiceId());
    }
}
