package com.flagship.period_ledger.eligibility;

/**
 * Participant class reported by the identity oracle.
 */
public enum ParticipantKind {
    /**
     * Pays one fee per period (e.g. a student).
     */
    PAYER,

    /**
     * Receives one payout per period (e.g. staff).
     */
    PAYEE,

    /**
     * Known to the oracle but eligible for neither action.
     */
    OTHER;

    /**
     * Lenient parse for oracle payloads; anything unrecognised is OTHER.
     */
    public static ParticipantKind fromOracleValue(String value) {
        if (value == null) {
            return OTHER;
        }
        for (ParticipantKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return OTHER;
    }
}
