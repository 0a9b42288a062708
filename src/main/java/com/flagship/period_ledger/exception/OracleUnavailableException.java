package com.flagship.period_ledger.exception;

public class OracleUnavailableException extends LedgerException {

    public OracleUnavailableException(String account, String reason) {
        this(account, reason, null);
    }

    public OracleUnavailableException(String account, String reason, Throwable cause) {
        super("ORACLE_UNAVAILABLE", ErrorCategory.DEPENDENCY_FAILURE,
                String.format("Identity oracle could not classify %s: %s", account, reason),
                detail("account", account), cause);
    }
}
