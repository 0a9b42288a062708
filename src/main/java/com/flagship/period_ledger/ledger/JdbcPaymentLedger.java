package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.period.Period;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Ledger backed by the {@code period_settlements} table.
 *
 * The composite primary key (account, year, month, kind) makes the table a
 * sparse set: only settled slots have a row, and a duplicate insert is a no-op.
 * Uses JDBC directly; the table is too simple to warrant an ORM mapping.
 */
@Slf4j
public class JdbcPaymentLedger implements PaymentLedger {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPaymentLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isSettled(String account, Period period, SettlementKind kind) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM period_settlements " +
            "WHERE account_id = ? AND period_year = ? AND period_month = ? AND kind = ?",
            Integer.class,
            account,
            period.getYear(),
            period.getMonth(),
            kind.name()
        );
        return count != null && count > 0;
    }

    @Override
    public void markSettled(String account, Period period, SettlementKind kind) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO period_settlements (account_id, period_year, period_month, kind, settled_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            account,
            period.getYear(),
            period.getMonth(),
            kind.name()
        );
        if (inserted == 0) {
            log.debug("Slot already settled: account={}, period={}, kind={}", account, period.label(), kind);
        }
    }
}
