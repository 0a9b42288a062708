package com.flagship.period_ledger.exception;

import java.time.Instant;

/**
 * Raised when the oracle's classification for an account is no longer valid.
 */
public class AttributeExpiredException extends LedgerException {

    private final Instant expiresAt;

    public AttributeExpiredException(String account, Instant expiresAt) {
        super("ATTRIBUTE_EXPIRED", ErrorCategory.DEPENDENCY_FAILURE,
                String.format("Classification for %s expired at %s", account, expiresAt),
                detail("account", account, "expiresAt", expiresAt));
        this.expiresAt = expiresAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
