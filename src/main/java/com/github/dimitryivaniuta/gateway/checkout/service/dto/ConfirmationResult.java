package com.github.dimitryivaniuta.gateway.checkout.service.dto;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;

/**
 * Outcome of a payment confirmation.
 *
 * @param redirectUrl absolute URL the payer is redirected to
 * @param status token status after confirmation, null when the token is unknown
 * @param success whether the payer is sent to the success page
 */
public record ConfirmationResult(String redirectUrl, CheckoutStatus status, boolean success) {}
