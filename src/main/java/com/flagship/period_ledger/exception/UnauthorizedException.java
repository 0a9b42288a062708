package com.flagship.period_ledger.exception;

/**
 * Raised when a caller without the required capability invokes an
 * administrative operation.
 */
public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String capability, String caller) {
        super("UNAUTHORIZED", ErrorCategory.AUTHORIZATION,
                String.format("Account %s lacks capability %s", caller, capability),
                detail("capability", capability, "caller", caller));
    }
}
