package com.flagship.period_ledger.exception;

public class InvalidReferenceException extends LedgerException {

    public InvalidReferenceException(String reference) {
        super("INVALID_REFERENCE", ErrorCategory.VALIDATION,
                "Oracle reference must not be empty",
                detail("reference", reference));
    }
}
