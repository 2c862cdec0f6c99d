package com.github.dimitryivaniuta.gateway.checkout.service.dto;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;

/**
 * Result of trying to settle a checkout.
 *
 * @param settled true only for the call that performed the PENDING to COMPLETED transition
 * @param status token status after the attempt
 * @param hints redirect hints (freshly returned by the notification, or the stored ones on replay)
 */
public record SettlementResult(boolean settled, CheckoutStatus status, PaymentAuthorizationResult hints) {}
