package com.flagship.period_ledger.payment;

import com.flagship.period_ledger.ledger.SettlementKind;
import com.flagship.period_ledger.period.Period;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Receipt of a completed fee collection or payout.
 */
@Value
public class Settlement {
    String account;
    Period period;
    SettlementKind kind;
    BigDecimal amount;
    Instant settledAt;
}
