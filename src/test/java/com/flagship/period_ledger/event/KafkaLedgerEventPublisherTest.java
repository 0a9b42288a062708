package com.flagship.period_ledger.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.period_ledger.config.JacksonConfig;
import com.flagship.period_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaLedgerEventPublisherTest {

    private static final String TOPIC = "ledger-events";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private SimpleMeterRegistry registry;
    private KafkaLedgerEventPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new KafkaLedgerEventPublisher(kafkaTemplate, objectMapper, new LedgerMetrics(registry), TOPIC);
    }

    @Test
    void publishesJsonKeyedByEventType() throws Exception {
        FeeAmountChangedEvent event = FeeAmountChangedEvent.of(new BigDecimal("150"), CLOCK);
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0, 0, 0, 0, 0);
        when(kafkaTemplate.send(eq(TOPIC), eq(FeeAmountChangedEvent.EVENT_TYPE), anyString()))
                .thenReturn(CompletableFuture.completedFuture(
                        new SendResult<>(new ProducerRecord<>(TOPIC, "k", "v"), metadata)));

        publisher.publish(event);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq(FeeAmountChangedEvent.EVENT_TYPE), payload.capture());
        JsonNode json = objectMapper.readTree(payload.getValue());
        assertEquals(150, json.get("amount").intValue());
        assertEquals(event.getEventId().toString(), json.get("eventId").asText());
        assertEquals(FeeAmountChangedEvent.EVENT_TYPE, json.get("eventType").asText());
        assertEquals("2024-03-10T09:00:00Z", json.get("occurredAt").asText());
        assertEquals(1.0, registry.get("ledger.events.published").counter().count());
    }

    @Test
    void brokerFailureIsCountedNotThrown() {
        when(kafkaTemplate.send(eq(TOPIC), eq(PaymentReminderEvent.EVENT_TYPE), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertDoesNotThrow(() -> publisher.publish(PaymentReminderEvent.create(CLOCK)));

        assertEquals(1.0, registry.get("ledger.events.publish_failure").counter().count());
    }

    @Test
    void synchronousSendFailureIsCounted() {
        when(kafkaTemplate.send(eq(TOPIC), eq(CurrentMonthChangedEvent.EVENT_TYPE), anyString()))
                .thenThrow(new KafkaException("metadata timeout"));

        assertDoesNotThrow(() -> publisher.publish(CurrentMonthChangedEvent.of(4, CLOCK)));

        assertEquals(1.0, registry.get("ledger.events.publish_failure").counter().count());
    }
}
