package com.flagship.period_ledger.exception;

public class InvalidYearException extends LedgerException {

    public InvalidYearException(int year, int epochFloorYear) {
        super("INVALID_YEAR", ErrorCategory.VALIDATION,
                String.format("Year must be after %d, got %d", epochFloorYear, year),
                detail("year", year, "epochFloorYear", epochFloorYear));
    }
}
