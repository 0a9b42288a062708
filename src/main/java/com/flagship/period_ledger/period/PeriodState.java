package com.flagship.period_ledger.period;

import com.flagship.period_ledger.admin.AccessControl;
import com.flagship.period_ledger.admin.SettingsLock;
import com.flagship.period_ledger.event.CurrentMonthChangedEvent;
import com.flagship.period_ledger.event.CurrentYearChangedEvent;
import com.flagship.period_ledger.event.LedgerEventPublisher;
import com.flagship.period_ledger.event.PaymentReminderEvent;
import com.flagship.period_ledger.exception.InvalidMonthException;
import com.flagship.period_ledger.exception.InvalidYearException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Holds the single live accounting period.
 *
 * No history is kept: changing the month or year simply moves "now", and the
 * ledger starts reading fresh slots for the new period. The epoch floor is
 * fixed when the state is created.
 */
@Slf4j
public class PeriodState {

    private final AccessControl accessControl;
    private final SettingsLock settingsLock;
    private final LedgerEventPublisher eventPublisher;
    private final int epochFloorYear;
    private final Clock clock;

    private Period current;

    public PeriodState(AccessControl accessControl,
                       SettingsLock settingsLock,
                       LedgerEventPublisher eventPublisher,
                       int epochFloorYear,
                       Period initial,
                       Clock clock) {
        this.accessControl = accessControl;
        this.settingsLock = settingsLock;
        this.eventPublisher = eventPublisher;
        this.epochFloorYear = epochFloorYear;
        this.clock = clock;
        validateMonth(initial.getMonth());
        validateYear(initial.getYear());
        this.current = initial;
    }

    public Period current() {
        return settingsLock.read(() -> current);
    }

    public int getEpochFloorYear() {
        return epochFloorYear;
    }

    /**
     * Moves the live period to another month of the current year and emits a
     * payment reminder.
     */
    public void setMonth(String caller, int month) {
        accessControl.requireAdmin(caller);
        validateMonth(month);

        settingsLock.change(
                () -> current = current.withMonth(month),
                () -> {
                    log.info("Current month changed: month={}, changedBy={}", month, caller);
                    eventPublisher.publish(CurrentMonthChangedEvent.of(month, clock));
                    eventPublisher.publish(PaymentReminderEvent.create(clock));
                });
    }

    public void setYear(String caller, int year) {
        accessControl.requireAdmin(caller);
        validateYear(year);

        settingsLock.change(
                () -> current = current.withYear(year),
                () -> {
                    log.info("Current year changed: year={}, changedBy={}", year, caller);
                    eventPublisher.publish(CurrentYearChangedEvent.of(year, clock));
                });
    }

    private void validateMonth(int month) {
        if (month < 1 || month > 12) {
            throw new InvalidMonthException(month);
        }
    }

    private void validateYear(int year) {
        if (year <= epochFloorYear) {
            throw new InvalidYearException(year, epochFloorYear);
        }
    }
}
