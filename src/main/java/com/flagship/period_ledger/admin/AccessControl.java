package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.exception.UnauthorizedException;

/**
 * Single-capability access control: an account either holds the
 * administrative capability or it does not.
 */
public interface AccessControl {

    String ADMIN_CAPABILITY = "LEDGER_ADMIN";

    boolean hasAdminCapability(String caller);

    /**
     * @throws UnauthorizedException if the caller lacks the administrative capability
     */
    default void requireAdmin(String caller) {
        if (!hasAdminCapability(caller)) {
            throw new UnauthorizedException(ADMIN_CAPABILITY, caller);
        }
    }
}
