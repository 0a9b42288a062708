package com.flagship.period_ledger.treasury;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * In-process custody balance.
 *
 * Retained fees are added to the balance and payouts are drawn from it. A
 * payout larger than the balance is refused without touching the balance.
 */
@Slf4j
public class Treasury implements FundsTransfer {

    private BigDecimal balance;

    public Treasury(BigDecimal initialBalance) {
        if (initialBalance == null || initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial treasury balance must be zero or positive");
        }
        this.balance = initialBalance;
    }

    @Override
    public synchronized boolean send(String to, BigDecimal amount) {
        if (amount.signum() <= 0) {
            log.warn("Refusing non-positive transfer: to={}, amount={}", to, amount);
            return false;
        }
        if (balance.compareTo(amount) < 0) {
            log.warn("Insufficient treasury balance: to={}, amount={}, balance={}", to, amount, balance);
            return false;
        }
        balance = balance.subtract(amount);
        log.debug("Sent {} to {}, balance={}", amount, to, balance);
        return true;
    }

    @Override
    public synchronized boolean retain(String from, BigDecimal amount) {
        if (amount.signum() <= 0) {
            log.warn("Refusing non-positive deposit: from={}, amount={}", from, amount);
            return false;
        }
        balance = balance.add(amount);
        log.debug("Retained {} from {}, balance={}", amount, from, balance);
        return true;
    }

    @Override
    public synchronized boolean refund(String to, BigDecimal amount) {
        if (balance.compareTo(amount) < 0) {
            log.warn("Insufficient treasury balance for refund: to={}, amount={}, balance={}", to, amount, balance);
            return false;
        }
        balance = balance.subtract(amount);
        log.info("Refunded {} to {}, balance={}", amount, to, balance);
        return true;
    }

    @Override
    public synchronized boolean reclaim(String from, BigDecimal amount) {
        balance = balance.add(amount);
        log.info("Reclaimed {} from {}, balance={}", amount, from, balance);
        return true;
    }

    public synchronized BigDecimal getBalance() {
        return balance;
    }
}
