package com.github.dimitryivaniuta.gateway.checkout.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Checkout lifecycle event waiting to be published to Kafka.
 *
 * <p>Written in the same transaction that settles a {@link CheckoutToken}, so consumers see a completion event
 * if and only if the settlement committed. The token doubles as the Kafka key, which keeps all events of one
 * checkout on one partition.</p>
 */
@Entity
@Table(
        name = "checkout_outbox",
        indexes = {
                @Index(name = "idx_checkout_outbox_pickup", columnList = "status,next_attempt_at,created_at"),
                @Index(name = "idx_checkout_outbox_token", columnList = "token")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "token", nullable = false, updatable = false, length = 140)
    private String token;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    /**
     * New, never attempted event for a checkout.
     *
     * @param eventType event type, e.g. {@code CheckoutCompleted}
     * @param token checkout token (Kafka key)
     * @param payload JSON payload
     * @return event
     */
    public static OutboxEvent forCheckout(String eventType, String token, String payload) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.eventType = Objects.requireNonNull(eventType, "eventType");
        e.token = Objects.requireNonNull(token, "token");
        e.payload = Objects.requireNonNull(payload, "payload");
        e.status = OutboxStatus.NEW;
        e.createdAt = Instant.now();
        return e;
    }

    /** Broker acknowledged the event. */
    public void published() {
        this.status = OutboxStatus.SENT;
        this.publishedAt = Instant.now();
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Failed attempt; the event is picked up again once {@code backoff} has passed.
     *
     * @param error failure description
     * @param backoff delay before the next attempt
     */
    public void retryAfter(String error, Duration backoff) {
        this.attempts++;
        this.status = OutboxStatus.RETRY;
        this.lastError = error;
        this.nextAttemptAt = Instant.now().plus(backoff);
    }

    /**
     * Final failed attempt. The event stays in the table for manual replay.
     *
     * @param error failure description
     */
    public void giveUp(String error) {
        this.attempts++;
        this.status = OutboxStatus.DEAD;
        this.lastError = error;
        this.nextAttemptAt = null;
    }
}
