package com.flagship.period_ledger.exception;

/**
 * Broad classes of ledger failures. The category decides how a failure is
 * reported over HTTP; none of them is retried inside the service.
 */
public enum ErrorCategory {
    /**
     * Caller lacks a capability, class, or standing.
     */
    AUTHORIZATION,

    /**
     * Input rejected; the caller must correct it and resubmit.
     */
    VALIDATION,

    /**
     * Action already settled for the current period.
     */
    STATE_CONFLICT,

    /**
     * An external collaborator (oracle, funds transfer) could not complete.
     */
    DEPENDENCY_FAILURE
}
