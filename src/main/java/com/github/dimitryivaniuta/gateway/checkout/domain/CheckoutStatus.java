package com.github.dimitryivaniuta.gateway.checkout.domain;

/**
 * Checkout token status stored as a string in the database.
 *
 * <p>Confirmation moves PENDING to COMPLETED or FAILED. COMPLETED is terminal; a new checkout request for
 * the same reference re-opens a FAILED token as PENDING.</p>
 */
public enum CheckoutStatus {
    /** Invoice created, payment not confirmed yet. */
    PENDING,

    /** Provider confirmed the invoice as paid; the reference record has been notified. */
    COMPLETED,

    /** Provider reported the invoice as unpayable. */
    FAILED
}
