package com.flagship.period_ledger.period;

import lombok.Value;

/**
 * An accounting period: a month of a year. Exactly one is live at a time.
 */
@Value
public class Period {
    int month;
    int year;

    public static Period of(int month, int year) {
        return new Period(month, year);
    }

    public Period withMonth(int newMonth) {
        return new Period(newMonth, year);
    }

    public Period withYear(int newYear) {
        return new Period(month, newYear);
    }

    /**
     * ISO-style label, e.g. {@code 2024-03}.
     */
    public String label() {
        return String.format("%04d-%02d", year, month);
    }
}
