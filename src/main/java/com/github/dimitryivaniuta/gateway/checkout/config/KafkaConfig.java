package com.github.dimitryivaniuta.gateway.checkout.config;

import java.time.Duration;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for checkout lifecycle events. Keyed by checkout token, so events of one checkout stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic checkoutEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getCheckoutEventsTopic())
                .partitions(3)
                .replicas(1)
                .config("retention.ms", String.valueOf(Duration.ofDays(7).toMillis()))
                .build();
    }
}
