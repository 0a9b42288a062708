package com.flagship.period_ledger.exception;

public class SuspendedParticipantException extends LedgerException {

    public SuspendedParticipantException(String account) {
        super("SUSPENDED_PARTICIPANT", ErrorCategory.AUTHORIZATION,
                "Account is suspended: " + account,
                detail("account", account));
    }
}
