package com.flagship.period_ledger.exception;

import com.flagship.period_ledger.eligibility.ParticipantKind;

public class WrongParticipantClassException extends LedgerException {

    public WrongParticipantClassException(ParticipantKind expected, ParticipantKind actual) {
        super("WRONG_PARTICIPANT_CLASS", ErrorCategory.AUTHORIZATION,
                String.format("Caller must be classified as %s but is %s", expected, actual),
                detail("expected", expected, "actual", actual));
    }
}
