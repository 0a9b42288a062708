package com.flagship.period_ledger.exception;

import java.math.BigDecimal;

/**
 * Raised when a fee payment does not carry exactly the configured fee.
 * Overpayment is rejected the same way as underpayment.
 */
public class IncorrectAmountException extends LedgerException {

    public IncorrectAmountException(BigDecimal expected, BigDecimal supplied) {
        super("INCORRECT_AMOUNT", ErrorCategory.VALIDATION,
                String.format("Expected exactly %s, got %s", expected.toPlainString(),
                        supplied == null ? "nothing" : supplied.toPlainString()),
                detail("expected", expected.toPlainString(),
                        "supplied", supplied == null ? "null" : supplied.toPlainString()));
    }
}
