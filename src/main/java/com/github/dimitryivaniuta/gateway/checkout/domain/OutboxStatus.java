package com.github.dimitryivaniuta.gateway.checkout.domain;

/**
 * Delivery state of an {@link OutboxEvent}. Stored by name.
 */
public enum OutboxStatus {
    NEW,
    /** Waiting for {@code nextAttemptAt}. */
    RETRY,
    SENT,
    /** Out of attempts; needs an operator. */
    DEAD
}
