package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.event.FeeAmountChangedEvent;
import com.flagship.period_ledger.event.LedgerEventPublisher;
import com.flagship.period_ledger.event.OracleReferenceChangedEvent;
import com.flagship.period_ledger.event.PayoutAmountChangedEvent;
import com.flagship.period_ledger.exception.InvalidReferenceException;
import com.flagship.period_ledger.exception.ZeroAmountException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Administrator-owned configuration: fee amount, payout amount and the
 * identity oracle reference.
 *
 * Every setter checks the administrative capability before validating its
 * input, so an unauthorized call never reveals validation details and never
 * changes state. Successful changes are published as events in the order they
 * were applied.
 */
@Slf4j
public class AdminConfig {

    private final AccessControl accessControl;
    private final SettingsLock settingsLock;
    private final LedgerEventPublisher eventPublisher;
    private final Clock clock;

    private BigDecimal feeAmount;
    private BigDecimal payoutAmount;
    private String oracleReference;

    public AdminConfig(AccessControl accessControl,
                       SettingsLock settingsLock,
                       LedgerEventPublisher eventPublisher,
                       BigDecimal feeAmount,
                       BigDecimal payoutAmount,
                       String oracleReference,
                       Clock clock) {
        this.accessControl = accessControl;
        this.settingsLock = settingsLock;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.feeAmount = requirePositive("feeAmount", feeAmount);
        this.payoutAmount = requirePositive("payoutAmount", payoutAmount);
        this.oracleReference = requireReference(oracleReference);
    }

    public BigDecimal getFeeAmount() {
        return settingsLock.read(() -> feeAmount);
    }

    public BigDecimal getPayoutAmount() {
        return settingsLock.read(() -> payoutAmount);
    }

    public String getOracleReference() {
        return settingsLock.read(() -> oracleReference);
    }

    public void setFee(String caller, BigDecimal amount) {
        accessControl.requireAdmin(caller);
        BigDecimal validated = requirePositive("feeAmount", amount);

        settingsLock.change(
                () -> feeAmount = validated,
                () -> {
                    log.info("Fee amount changed: amount={}, changedBy={}", validated, caller);
                    eventPublisher.publish(FeeAmountChangedEvent.of(validated, clock));
                });
    }

    public void setPayout(String caller, BigDecimal amount) {
        accessControl.requireAdmin(caller);
        BigDecimal validated = requirePositive("payoutAmount", amount);

        settingsLock.change(
                () -> payoutAmount = validated,
                () -> {
                    log.info("Payout amount changed: amount={}, changedBy={}", validated, caller);
                    eventPublisher.publish(PayoutAmountChangedEvent.of(validated, clock));
                });
    }

    public void setOracleReference(String caller, String reference) {
        accessControl.requireAdmin(caller);
        String validated = requireReference(reference);

        settingsLock.change(
                () -> oracleReference = validated,
                () -> {
                    log.info("Oracle reference changed: reference={}, changedBy={}", validated, caller);
                    eventPublisher.publish(OracleReferenceChangedEvent.of(validated, clock));
                });
    }

    private static BigDecimal requirePositive(String field, BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new ZeroAmountException(field, amount);
        }
        return amount;
    }

    private static String requireReference(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidReferenceException(reference);
        }
        return reference.trim();
    }
}
