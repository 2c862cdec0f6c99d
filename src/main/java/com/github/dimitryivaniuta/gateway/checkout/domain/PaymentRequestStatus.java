package com.github.dimitryivaniuta.gateway.checkout.domain;

/**
 * Status of a payment request as seen by the order side.
 */
public enum PaymentRequestStatus {
    /** Waiting for the payer. */
    INITIATED,

    /** Payment authorized through the hosted checkout. */
    PAID,

    /** Withdrawn by the merchant. */
    CANCELLED
}
