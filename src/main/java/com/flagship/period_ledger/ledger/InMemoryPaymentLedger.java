package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.period.Period;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger held in a concurrent hash set of settled keys.
 * Used when {@code ledger.store=memory} and by tests.
 */
@Slf4j
public class InMemoryPaymentLedger implements PaymentLedger {

    private final Set<LedgerKey> settled = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isSettled(String account, Period period, SettlementKind kind) {
        return settled.contains(new LedgerKey(account, period, kind));
    }

    @Override
    public void markSettled(String account, Period period, SettlementKind kind) {
        if (!settled.add(new LedgerKey(account, period, kind))) {
            log.debug("Slot already settled: account={}, period={}, kind={}", account, period.label(), kind);
        }
    }

    public int size() {
        return settled.size();
    }
}
