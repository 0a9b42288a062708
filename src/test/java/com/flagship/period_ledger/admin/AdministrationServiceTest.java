package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.exception.UnauthorizedException;
import com.flagship.period_ledger.observability.LedgerMetrics;
import com.flagship.period_ledger.period.Period;
import com.flagship.period_ledger.period.PeriodState;
import com.flagship.period_ledger.support.RecordingEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdministrationServiceTest {

    private static final String ADMIN = "admin";

    private SimpleMeterRegistry registry;
    private AdministrationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        SettingsLock lock = new SettingsLock();
        AccessControl accessControl = new ConfiguredAccessControl(List.of(ADMIN));
        RecordingEventPublisher events = new RecordingEventPublisher();
        AdminConfig adminConfig = new AdminConfig(accessControl, lock, events,
                new BigDecimal("100"), new BigDecimal("500"), "http://oracle", Clock.systemUTC());
        PeriodState periodState = new PeriodState(accessControl, lock, events, 2000, Period.of(3, 2024),
                Clock.systemUTC());
        service = new AdministrationService(adminConfig, periodState, lock, new LedgerMetrics(registry));
    }

    @Test
    void snapshotReflectsEveryChange() {
        service.setFee(ADMIN, new BigDecimal("110"));
        service.setPayout(ADMIN, new BigDecimal("520"));
        service.setMonth(ADMIN, 7);
        service.setYear(ADMIN, 2025);
        service.setOracleReference(ADMIN, "http://oracle-2");

        SettingsSnapshot snapshot = service.snapshot();

        assertEquals(new BigDecimal("110"), snapshot.getFeeAmount());
        assertEquals(new BigDecimal("520"), snapshot.getPayoutAmount());
        assertEquals("http://oracle-2", snapshot.getOracleReference());
        assertEquals(Period.of(7, 2025), snapshot.getPeriod());
        assertEquals(1.0, registry.get("ledger.settings.changed").tag("setting", "month").counter().count());
    }

    @Test
    void rejectedChangeIsNotCounted() {
        assertThrows(UnauthorizedException.class, () -> service.setMonth("mallory", 5));

        assertNull(registry.find("ledger.settings.changed").counter());
        assertEquals(Period.of(3, 2024), service.snapshot().getPeriod());
    }
}
