package com.flagship.period_ledger.ledger;

import com.flagship.period_ledger.period.Period;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the JDBC ledger against a real PostgreSQL with the production schema.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcPaymentLedgerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("period_ledger_test")
            .withUsername("test")
            .withPassword("test");

    private JdbcTemplate jdbcTemplate;
    private JdbcPaymentLedger ledger;
    private String account;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource =
                new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        ledger = new JdbcPaymentLedger(jdbcTemplate);
        account = "acct-" + UUID.randomUUID();
    }

    @Test
    void absentSlotIsUnsettled() {
        assertFalse(ledger.isSettled(account, Period.of(3, 2024), SettlementKind.FEE));
    }

    @Test
    void markedSlotIsSettledAndIsolated() {
        ledger.markSettled(account, Period.of(3, 2024), SettlementKind.FEE);

        assertTrue(ledger.isSettled(account, Period.of(3, 2024), SettlementKind.FEE));
        assertFalse(ledger.isSettled(account, Period.of(3, 2024), SettlementKind.PAYOUT));
        assertFalse(ledger.isSettled(account, Period.of(4, 2024), SettlementKind.FEE));
    }

    @Test
    @DisplayName("Duplicate mark inserts no second row")
    void markingTwiceKeepsOneRow() {
        ledger.markSettled(account, Period.of(3, 2024), SettlementKind.PAYOUT);
        ledger.markSettled(account, Period.of(3, 2024), SettlementKind.PAYOUT);

        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM period_settlements WHERE account_id = ?", Integer.class, account);
        assertEquals(1, rows);
    }
}
