package com.flagship.period_ledger.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.period_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Publishes settings notifications to Kafka as JSON.
 *
 * The event type is the record key, so all changes of one setting land on
 * the same partition and keep their order. Sends are asynchronous; the
 * outcome is logged and counted when the broker acknowledges or rejects it.
 */
@Slf4j
public class KafkaLedgerEventPublisher implements LedgerEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final String topic;

    public KafkaLedgerEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                     ObjectMapper objectMapper,
                                     LedgerMetrics metrics,
                                     String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topic = topic;
    }

    @Override
    public void publish(LedgerEvent event) {
        String payload = serializePayload(event);

        try {
            kafkaTemplate.send(topic, event.getEventType(), payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            recordFailure(event, ex);
                            return;
                        }
                        log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                                event.getEventId(),
                                result.getRecordMetadata().topic(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset(),
                                event.getEventType());
                        metrics.recordEventPublished(event.getEventType());
                    });
        } catch (RuntimeException e) {
            // send() itself throws when producer metadata is unavailable within max.block.ms
            recordFailure(event, e);
        }
    }

    private void recordFailure(LedgerEvent event, Throwable error) {
        log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getEventId(), event.getEventType(), error.getMessage());
        metrics.recordEventPublishFailure(event.getEventType());
    }

    private String serializePayload(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
