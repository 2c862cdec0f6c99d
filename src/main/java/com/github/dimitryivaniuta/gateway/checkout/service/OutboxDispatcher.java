package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import com.github.dimitryivaniuta.gateway.checkout.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.checkout.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.checkout.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes checkout outbox events to Kafka.
 *
 * <p>Opt-in with {@code app.outbox.publisher-enabled=true}. Without it completion events are still written to
 * {@code checkout_outbox} by the settlement transaction and stay NEW until a publisher runs.</p>
 *
 * <ul>
 *   <li>Batches are locked with {@code FOR UPDATE SKIP LOCKED}, so several instances can run side by side.</li>
 *   <li>An event is SENT only after the broker acknowledged it within {@code sendTimeout}.</li>
 *   <li>Failures are retried with exponential backoff and jitter, then parked as DEAD after {@code maxAttempts}.</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "app.outbox", name = "publisher-enabled", havingValue = "true")
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    /**
     * Creates the dispatcher.
     *
     * @param outboxEventRepository outbox repository
     * @param kafkaTemplate Kafka template
     * @param properties app config
     * @param meterRegistry metrics registry
     */
    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;

        this.sentCounter = Counter.builder("checkout.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("checkout.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("checkout.outbox.dead").register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public void publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();

        List<OutboxEvent> batch = outboxEventRepository.lockDueEvents(
                List.of(OutboxStatus.NEW.name(), OutboxStatus.RETRY.name()),
                Instant.now(),
                outbox.getBatchSize()
        );
        if (batch.isEmpty()) {
            return;
        }

        int sent = 0;
        int failed = 0;
        for (OutboxEvent e : batch) {
            if (publish(e, outbox)) {
                sent++;
            } else {
                failed++;
            }
            outboxEventRepository.save(e);
        }

        log.info("Checkout events published. sent={} failed={} topic={}", sent, failed, outbox.getCheckoutEventsTopic());
    }

    private boolean publish(OutboxEvent e, AppProperties.Outbox outbox) {
        try {
            kafkaTemplate.send(outbox.getCheckoutEventsTopic(), e.getToken(), e.getPayload())
                    .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            e.published();
            sentCounter.increment();
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            e.retryAfter("interrupted", outbox.getBaseBackoff());
            retryCounter.increment();
            return false;
        } catch (Exception ex) {
            String err = errorText(ex);
            int attempt = e.getAttempts() + 1;
            if (attempt >= outbox.getMaxAttempts()) {
                e.giveUp(err);
                deadCounter.increment();
                log.error("{} for token {} is DEAD after {} attempts. eventId={} error={}",
                        e.getEventType(), e.getToken(), attempt, e.getId(), err);
            } else {
                e.retryAfter(err, backoff(outbox.getBaseBackoff(), outbox.getMaxBackoff(), attempt));
                retryCounter.increment();
                log.warn("{} for token {} not published. attempt={} nextAttemptAt={} error={}",
                        e.getEventType(), e.getToken(), attempt, e.getNextAttemptAt(), err);
            }
            return false;
        }
    }

    static Duration backoff(Duration base, Duration max, int attempt) {
        // base * 2^(attempt-1), capped, jitter in [0.5, 1.5)
        long candidateMs = (long) (base.toMillis() * Math.pow(2.0, Math.max(0, attempt - 1)));
        long capped = Math.min(candidateMs, max.toMillis());
        long withJitter = (long) (capped * (0.5 + ThreadLocalRandom.current().nextDouble()));
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    private static String errorText(Exception ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 2000 ? msg.substring(0, 2000) : msg;
    }
}
