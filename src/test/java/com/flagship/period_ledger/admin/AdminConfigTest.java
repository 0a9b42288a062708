package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.event.FeeAmountChangedEvent;
import com.flagship.period_ledger.event.OracleReferenceChangedEvent;
import com.flagship.period_ledger.event.PayoutAmountChangedEvent;
import com.flagship.period_ledger.exception.InvalidReferenceException;
import com.flagship.period_ledger.exception.UnauthorizedException;
import com.flagship.period_ledger.exception.ZeroAmountException;
import com.flagship.period_ledger.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AdminConfigTest {

    private static final String ADMIN = "admin";
    private static final String STRANGER = "mallory";
    private static final Instant NOW = Instant.parse("2024-03-10T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private RecordingEventPublisher events;
    private AdminConfig config;

    @BeforeEach
    void setUp() {
        events = new RecordingEventPublisher();
        config = new AdminConfig(new ConfiguredAccessControl(List.of(ADMIN)), new SettingsLock(), events,
                new BigDecimal("100"), new BigDecimal("500"), "http://oracle", CLOCK);
    }

    @Nested
    @DisplayName("Amounts")
    class Amounts {

        @Test
        void adminSetsFeeAndEventCarriesAmount() {
            config.setFee(ADMIN, new BigDecimal("120"));

            assertEquals(new BigDecimal("120"), config.getFeeAmount());
            assertEquals(List.of(FeeAmountChangedEvent.EVENT_TYPE), events.getEventTypes());
            assertEquals(new BigDecimal("120"), ((FeeAmountChangedEvent) events.getEvents().get(0)).getAmount());
            assertEquals(NOW, events.getEvents().get(0).getOccurredAt());
        }

        @Test
        void adminSetsPayout() {
            config.setPayout(ADMIN, new BigDecimal("750"));

            assertEquals(new BigDecimal("750"), config.getPayoutAmount());
            assertEquals(List.of(PayoutAmountChangedEvent.EVENT_TYPE), events.getEventTypes());
        }

        @Test
        void zeroFeeRejected() {
            ZeroAmountException e = assertThrows(ZeroAmountException.class, () -> config.setFee(ADMIN, BigDecimal.ZERO));

            assertEquals("feeAmount", e.getDetails().get("field"));
            assertEquals(new BigDecimal("100"), config.getFeeAmount());
            assertTrue(events.getEvents().isEmpty());
        }

        @Test
        void zeroPayoutRejected() {
            assertThrows(ZeroAmountException.class, () -> config.setPayout(ADMIN, new BigDecimal("0.00")));
            assertEquals(new BigDecimal("500"), config.getPayoutAmount());
        }

        @Test
        void negativeAmountRejected() {
            assertThrows(ZeroAmountException.class, () -> config.setFee(ADMIN, new BigDecimal("-1")));
        }

        @Test
        void nullAmountRejected() {
            assertThrows(IllegalArgumentException.class, () -> config.setPayout(ADMIN, null));
        }
    }

    @Nested
    @DisplayName("Oracle reference")
    class OracleReference {

        @Test
        void adminSetsReference() {
            config.setOracleReference(ADMIN, "  http://oracle-2 ");

            assertEquals("http://oracle-2", config.getOracleReference());
            assertEquals("http://oracle-2",
                    ((OracleReferenceChangedEvent) events.getEvents().get(0)).getReference());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   "})
        void emptyReferenceRejected(String reference) {
            assertThrows(InvalidReferenceException.class, () -> config.setOracleReference(ADMIN, reference));
            assertEquals("http://oracle", config.getOracleReference());
        }
    }

    @Test
    @DisplayName("Non-admin callers are rejected and nothing changes")
    void nonAdminRejectedForEverySetter() {
        assertThrows(UnauthorizedException.class, () -> config.setFee(STRANGER, new BigDecimal("1")));
        assertThrows(UnauthorizedException.class, () -> config.setPayout(STRANGER, new BigDecimal("1")));
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> config.setOracleReference(STRANGER, "http://evil"));

        assertEquals(AccessControl.ADMIN_CAPABILITY, e.getDetails().get("capability"));
        assertEquals(STRANGER, e.getDetails().get("caller"));
        assertEquals(new BigDecimal("100"), config.getFeeAmount());
        assertEquals(new BigDecimal("500"), config.getPayoutAmount());
        assertEquals("http://oracle", config.getOracleReference());
        assertTrue(events.getEvents().isEmpty());
    }

    @Test
    void nullCallerIsNotAdmin() {
        assertThrows(UnauthorizedException.class, () -> config.setFee(null, new BigDecimal("1")));
    }

    @Test
    void invalidInitialValuesRejected() {
        ConfiguredAccessControl accessControl = new ConfiguredAccessControl(List.of(ADMIN));
        SettingsLock lock = new SettingsLock();

        assertThrows(ZeroAmountException.class, () -> new AdminConfig(accessControl, lock, events,
                BigDecimal.ZERO, BigDecimal.ONE, "http://oracle", CLOCK));
        assertThrows(InvalidReferenceException.class, () -> new AdminConfig(accessControl, lock, events,
                BigDecimal.ONE, BigDecimal.ONE, "", CLOCK));
    }

    @Test
    @DisplayName("Racing fee changes are announced in the order they were applied")
    void concurrentChangesPublishInApplyOrder() throws Exception {
        CountDownLatch firstPublishing = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicReference<BigDecimal> lastAnnounced = new AtomicReference<>();
        AdminConfig raced = new AdminConfig(new ConfiguredAccessControl(List.of(ADMIN)), new SettingsLock(),
                event -> {
                    BigDecimal amount = ((FeeAmountChangedEvent) event).getAmount();
                    if (amount.compareTo(new BigDecimal("120")) == 0) {
                        firstPublishing.countDown();
                        try {
                            releaseFirst.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    lastAnnounced.set(amount);
                },
                new BigDecimal("100"), new BigDecimal("500"), "http://oracle", CLOCK);

        Thread first = new Thread(() -> raced.setFee(ADMIN, new BigDecimal("120")));
        first.start();
        assertTrue(firstPublishing.await(5, TimeUnit.SECONDS));

        Thread second = new Thread(() -> raced.setFee(ADMIN, new BigDecimal("130")));
        second.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (second.getState() != Thread.State.WAITING
                && second.getState() != Thread.State.TERMINATED
                && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }

        // the first change is applied and readable while its announcement is in flight
        assertEquals(new BigDecimal("120"), raced.getFeeAmount());

        releaseFirst.countDown();
        first.join(5000);
        second.join(5000);

        assertEquals(new BigDecimal("130"), raced.getFeeAmount());
        assertEquals(raced.getFeeAmount(), lastAnnounced.get());
    }
}
