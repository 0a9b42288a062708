package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.period.Period;

/**
 * Per-account, per-period record of settled actions.
 *
 * Absent slots read as unsettled. Slots are only ever set, never cleared;
 * a new period naturally starts from a fresh unset slot.
 */
public interface PaymentLedger {

    /**
     * Longest account id a ledger accepts; matches {@code period_settlements.account_id}.
     */
    int MAX_ACCOUNT_LENGTH = 128;

    boolean isSettled(String account, Period period, SettlementKind kind);

    /**
     * Marks the slot settled. Marking an already settled slot has no effect.
     */
    void markSettled(String account, Period period, SettlementKind kind);
}
