package com.flagship.period_ledger.exception;

public class InvalidMonthException extends LedgerException {

    public InvalidMonthException(int month) {
        super("INVALID_MONTH", ErrorCategory.VALIDATION,
                String.format("Month must be between 1 and 12, got %d", month),
                detail("month", month));
    }
}
