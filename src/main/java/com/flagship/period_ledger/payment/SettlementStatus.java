package com.flagship.period_ledger.payment;

import com.flagship.period_ledger.period.Period;
import lombok.Value;

@Value
public class SettlementStatus {
    String account;
    Period period;
    boolean feeSettled;
    boolean payoutSettled;
}
