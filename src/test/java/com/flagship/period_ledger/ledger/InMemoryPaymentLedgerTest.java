package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.period.Period;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPaymentLedgerTest {

    private final InMemoryPaymentLedger ledger = new InMemoryPaymentLedger();

    @Test
    void absentSlotIsUnsettled() {
        assertFalse(ledger.isSettled("alice", Period.of(3, 2024), SettlementKind.FEE));
        assertEquals(0, ledger.size());
    }

    @Test
    void markedSlotIsSettled() {
        ledger.markSettled("alice", Period.of(3, 2024), SettlementKind.FEE);

        assertTrue(ledger.isSettled("alice", Period.of(3, 2024), SettlementKind.FEE));
    }

    @Test
    void slotsAreIndependentPerAccountPeriodAndKind() {
        ledger.markSettled("alice", Period.of(3, 2024), SettlementKind.FEE);

        assertFalse(ledger.isSettled("bob", Period.of(3, 2024), SettlementKind.FEE));
        assertFalse(ledger.isSettled("alice", Period.of(4, 2024), SettlementKind.FEE));
        assertFalse(ledger.isSettled("alice", Period.of(3, 2025), SettlementKind.FEE));
        assertFalse(ledger.isSettled("alice", Period.of(3, 2024), SettlementKind.PAYOUT));
    }

    @Test
    void markingTwiceIsHarmless() {
        ledger.markSettled("alice", Period.of(3, 2024), SettlementKind.PAYOUT);
        ledger.markSettled("alice", Period.of(3, 2024), SettlementKind.PAYOUT);

        assertTrue(ledger.isSettled("alice", Period.of(3, 2024), SettlementKind.PAYOUT));
        assertEquals(1, ledger.size());
    }
}
