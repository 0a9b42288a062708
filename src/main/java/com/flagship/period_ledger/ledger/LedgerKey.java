package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.period.Period;
import lombok.Value;

/**
 * Composite key of a ledger slot.
 */
@Value
public class LedgerKey {
    String account;
    Period period;
    SettlementKind kind;
}
