package com.flagship.period_ledger.exception;

import java.math.BigDecimal;

public class TransferFailedException extends LedgerException {

    public TransferFailedException(String account, BigDecimal amount, String reason) {
        this(account, amount, reason, null);
    }

    public TransferFailedException(String account, BigDecimal amount, String reason, Throwable cause) {
        super("TRANSFER_FAILED", ErrorCategory.DEPENDENCY_FAILURE,
                String.format("Transfer of %s for %s failed: %s", amount.toPlainString(), account, reason),
                detail("account", account, "amount", amount.toPlainString()), cause);
    }
}
