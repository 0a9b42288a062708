package com.flagship.period_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.settlements: settlement attempts, tagged by kind and outcome
 *   (success or the failure code)
 * - ledger.operation.latency: duration of gateway operations
 * - ledger.settings.changed: administrative changes, tagged by setting
 * - ledger.events.published / ledger.events.publish_failure: notification delivery
 */
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSettlement(String kind, String outcome) {
        registry.counter("ledger.settlements",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordSettingChanged(String setting) {
        registry.counter("ledger.settings.changed", "setting", sanitizeTag(setting)).increment();
    }

    public void recordEventPublished(String eventType) {
        registry.counter("ledger.events.published", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventPublishFailure(String eventType) {
        registry.counter("ledger.events.publish_failure", "event_type", sanitizeTag(eventType)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
