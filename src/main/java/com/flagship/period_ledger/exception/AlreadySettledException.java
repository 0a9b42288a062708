package com.flagship.period_ledger.exception;

import com.flagship.period_ledger.ledger.SettlementKind;
import com.flagship.period_ledger.period.Period;

import java.util.Map;

/**
 * Raised when the caller already completed this action in the current period.
 * Resubmitting within the same period will keep failing.
 */
public class AlreadySettledException extends LedgerException {

    public AlreadySettledException(String account, Period period, SettlementKind kind) {
        super("ALREADY_SETTLED", ErrorCategory.STATE_CONFLICT,
                String.format("%s already settled for account %s in period %s", kind, account, period.label()),
                details(account, period, kind));
    }

    private static Map<String, String> details(String account, Period period, SettlementKind kind) {
        Map<String, String> details = detail("account", account, "period", period.label());
        details.put("kind", kind.name());
        return details;
    }
}
