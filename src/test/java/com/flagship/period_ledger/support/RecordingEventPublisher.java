package com.flagship.period_ledger.support;

import com.flagship.period_ledger.event.LedgerEvent;
import com.flagship.period_ledger.event.LedgerEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingEventPublisher implements LedgerEventPublisher {

    private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(LedgerEvent event) {
        events.add(event);
    }

    public List<LedgerEvent> getEvents() {
        return events;
    }

    public List<String> getEventTypes() {
        return events.stream().map(LedgerEvent::getEventType).collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
