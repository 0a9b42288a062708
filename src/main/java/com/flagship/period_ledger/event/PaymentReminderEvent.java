package com.flagship.period_ledger.event;

import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted alongside every month change: a new period is open and
 * participants can settle again.
 */
@Value
public class PaymentReminderEvent implements LedgerEvent {
    UUID eventId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentReminder";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentReminderEvent create(Clock clock) {
        return new PaymentReminderEvent(UUID.randomUUID(), clock.instant());
    }
}
