package com.flagship.period_ledger.event;

/**
 * Outlet for settings notifications.
 */
public interface LedgerEventPublisher {

    /**
     * Publishes the event. Delivery may complete asynchronously; failures are
     * reported by the implementation and never undo the settings change.
     */
    void publish(LedgerEvent event);
}
