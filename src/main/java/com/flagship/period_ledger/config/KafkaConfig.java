package com.flagship.period_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.period_ledger.event.KafkaLedgerEventPublisher;
import com.flagship.period_ledger.event.LedgerEventPublisher;
import com.flagship.period_ledger.observability.LedgerMetrics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Kafka configuration for settings notifications.
 *
 * Disabled with {@code events.kafka.enabled=false}, in which case events are
 * only logged.
 */
@Configuration
@ConditionalOnProperty(name = "events.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    /**
     * Creates the ledger events topic if it doesn't exist.
     * A single partition keeps all settings changes totally ordered.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }

    @Bean
    public LedgerEventPublisher kafkaLedgerEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                                          ObjectMapper objectMapper,
                                                          LedgerMetrics metrics) {
        return new KafkaLedgerEventPublisher(kafkaTemplate, objectMapper, metrics, ledgerEventsTopic);
    }
}
