package com.flagship.period_ledger.eligibility;

import lombok.Value;

import java.time.Instant;

/**
 * The oracle's verdict on an account.
 *
 * Never stored; fetched fresh for every gated action.
 */
@Value
public class Classification {
    ParticipantKind kind;
    Instant expiresAt;
    boolean suspended;

    /**
     * True while {@code expiresAt} lies strictly after {@code now}.
     */
    public boolean isValidAt(Instant now) {
        return expiresAt.isAfter(now);
    }
}
