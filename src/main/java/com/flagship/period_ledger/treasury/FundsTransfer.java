package com.flagship.period_ledger.treasury;

import java.math.BigDecimal;

/**
 * Funds transfer primitive. Implementations report failure by returning
 * false and must answer in bounded time.
 */
public interface FundsTransfer {

    /**
     * Moves {@code amount} out of custody to {@code to}.
     */
    boolean send(String to, BigDecimal amount);

    /**
     * Keeps a value that arrived together with a fee payment from {@code from}.
     */
    boolean retain(String from, BigDecimal amount);

    /**
     * Returns a previously retained value to {@code to}.
     */
    boolean refund(String to, BigDecimal amount);

    /**
     * Takes back a payout previously sent to {@code from}.
     */
    boolean reclaim(String from, BigDecimal amount);
}
