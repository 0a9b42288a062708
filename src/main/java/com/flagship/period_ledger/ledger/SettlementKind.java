package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.eligibility.ParticipantKind;

/**
 * The two actions a participant can settle once per period.
 */
public enum SettlementKind {
    FEE(ParticipantKind.PAYER),
    PAYOUT(ParticipantKind.PAYEE);

    private final ParticipantKind requiredClass;

    SettlementKind(ParticipantKind requiredClass) {
        this.requiredClass = requiredClass;
    }

    /**
     * Participant class a caller must hold to perform this action.
     */
    public ParticipantKind requiredClass() {
        return requiredClass;
    }
}
