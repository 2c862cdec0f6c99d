package com.github.dimitryivaniuta.gateway.checkout;

import com.github.dimitryivaniuta.gateway.checkout.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.checkout.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.checkout.provider.InvoiceProvider;
import com.github.dimitryivaniuta.gateway.checkout.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.checkout.service.OutboxDispatcher;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * Verifies that the outbox dispatcher publishes checkout events and marks them SENT only on ack.
 */
@SpringBootTest(properties = "app.outbox.publisher-enabled=true")
class OutboxDispatcherTest extends PostgresContainerSupport {

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    @MockBean
    InvoiceProvider invoiceProvider;

    @Autowired
    OutboxEventRepository repo;

    @Autowired
    OutboxDispatcher dispatcher;

    @Test
    void dispatcherMarksSent() {
        String token = "PR-" + UUID.randomUUID();
        OutboxEvent e = OutboxEvent.forCheckout("CheckoutCompleted", token, "{\"ok\":true}");
        repo.save(e);

        // Kafka send must return an already-completed future (ack success).
        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(ok);

        dispatcher.publishBatch();

        OutboxEvent updated = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.SENT, updated.getStatus());

        // other checkout tests may have left events behind; only ours matters here
        Mockito.verify(kafkaTemplate).send("checkout-events", token, "{\"ok\":true}");
    }

    @Test
    void failedSendIsScheduledForRetry() {
        String token = "PR-" + UUID.randomUUID();
        OutboxEvent e = OutboxEvent.forCheckout("CheckoutCompleted", token, "{}");
        repo.save(e);

        CompletableFuture<SendResult<String, String>> broken =
                CompletableFuture.failedFuture(new IllegalStateException("broker down"));
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(broken);

        dispatcher.publishBatch();

        OutboxEvent updated = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.RETRY, updated.getStatus());
        Assertions.assertEquals(1, updated.getAttempts());
        Assertions.assertEquals("broker down", updated.getLastError());
        Assertions.assertNotNull(updated.getNextAttemptAt());
    }
}
