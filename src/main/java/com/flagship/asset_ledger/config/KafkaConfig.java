package com.flagship.asset_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger domain events.
 *
 * Only declared when event publishing is switched on.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.events.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    /**
     * Creates the events topic if it doesn't exist.
     * Events are keyed by aggregate id, so per-record ordering holds per partition.
     */
    @Bean
    public NewTopic ledgerEventsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getEvents().getTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
