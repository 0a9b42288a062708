package com.flagship.period_ledger.eligibility;

/**
 * External identity-verification oracle.
 *
 * Implementations may block on I/O but must fail in bounded time; any
 * runtime exception is treated as the oracle being unavailable.
 */
@FunctionalInterface
public interface IdentityOracle {

    /**
     * @param oracleReference endpoint of the oracle currently configured by the administrator
     * @param account account to classify
     * @return the classification, or null when the oracle has no answer
     */
    Classification classify(String oracleReference, String account);
}
