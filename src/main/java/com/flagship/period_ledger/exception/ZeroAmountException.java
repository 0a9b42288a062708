package com.flagship.period_ledger.exception;

import java.math.BigDecimal;

/**
 * Raised when a configured amount is not strictly positive.
 */
public class ZeroAmountException extends LedgerException {

    public ZeroAmountException(String field, BigDecimal amount) {
        super("ZERO_AMOUNT", ErrorCategory.VALIDATION,
                String.format("%s must be greater than zero, got %s", field, amount.toPlainString()),
                detail("field", field, "amount", amount.toPlainString()));
    }
}
