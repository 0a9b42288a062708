package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.period.Period;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Consistent read of the whole configuration and the live period.
 */
@Value
public class SettingsSnapshot {
    BigDecimal feeAmount;
    BigDecimal payoutAmount;
    String oracleReference;
    Period period;
}
