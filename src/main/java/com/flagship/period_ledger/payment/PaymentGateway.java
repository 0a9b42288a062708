package com.flagship.period_ledger.payment;

import com.flagship.period_ledger.admin.AdminConfig;
import com.flagship.period_ledger.admin.SettingsLock;
import com.flagship.period_ledger.eligibility.Classification;
import com.flagship.period_ledger.eligibility.EligibilityOracleClient;
import com.flagship.period_ledger.eligibility.ParticipantKind;
import com.flagship.period_ledger.exception.AlreadySettledException;
import com.flagship.period_ledger.exception.IncorrectAmountException;
import com.flagship.period_ledger.exception.LedgerException;
import com.flagship.period_ledger.exception.SuspendedParticipantException;
import com.flagship.period_ledger.exception.TransferFailedException;
import com.flagship.period_ledger.exception.WrongParticipantClassException;
import com.flagship.period_ledger.ledger.PaymentLedger;
import com.flagship.period_ledger.ledger.SettlementKind;
import com.flagship.period_ledger.observability.CorrelationContext;
import com.flagship.period_ledger.observability.LedgerMetrics;
import com.flagship.period_ledger.period.Period;
import com.flagship.period_ledger.period.PeriodState;
import com.flagship.period_ledger.treasury.FundsTransfer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for the two gated actions: collecting a period fee from a payer
 * and disbursing a period payout to a payee.
 *
 * Both run the same short-circuit pipeline:
 * 1. classify the caller and reject an expired classification
 * 2. require the caller's class to match the action
 * 3. reject suspended callers
 * 4. reject a slot already settled for the current period
 * 5. (fee only) require exactly the configured fee
 * 6. move the funds
 * 7. mark the slot settled
 *
 * The settings read lock is held for the whole pipeline so period and amounts
 * cannot change underneath it. Steps 4 to 7 additionally run under a lock
 * striped by (account, kind), which makes check, transfer and commit atomic
 * for a slot: two concurrent calls for the same slot cannot both pass step 4.
 * The slot is marked only after the transfer succeeded, so a failed transfer
 * leaves the ledger untouched. If the mark itself fails, the transfer is
 * reversed before the stripe lock is released.
 */
@Slf4j
public class PaymentGateway {

    private static final int LOCK_STRIPES = 64;

    private final EligibilityOracleClient oracleClient;
    private final PaymentLedger ledger;
    private final PeriodState periodState;
    private final AdminConfig adminConfig;
    private final FundsTransfer fundsTransfer;
    private final SettingsLock settingsLock;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final Lock[] stripes;

    public PaymentGateway(EligibilityOracleClient oracleClient,
                          PaymentLedger ledger,
                          PeriodState periodState,
                          AdminConfig adminConfig,
                          FundsTransfer fundsTransfer,
                          SettingsLock settingsLock,
                          LedgerMetrics metrics,
                          Clock clock) {
        this.oracleClient = oracleClient;
        this.ledger = ledger;
        this.periodState = periodState;
        this.adminConfig = adminConfig;
        this.fundsTransfer = fundsTransfer;
        this.settingsLock = settingsLock;
        this.metrics = metrics;
        this.clock = clock;
        this.stripes = new Lock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Collects the period fee from a payer. {@code value} is the amount that
     * arrived with the call; it is retained only when every check passes.
     *
     * @return receipt of the settled fee
     */
    public Settlement collectFee(String caller, BigDecimal value) {
        return settle(caller, SettlementKind.FEE, value);
    }

    /**
     * Sends the configured payout to a payee.
     *
     * @return receipt of the settled payout
     */
    public Settlement disburse(String caller) {
        return settle(caller, SettlementKind.PAYOUT, null);
    }

    /**
     * Settlement state of the account for the live period. Does not consult the oracle.
     */
    public SettlementStatus settlementStatus(String account) {
        requireAccount(account);
        return settingsLock.read(() -> {
            Period period = periodState.current();
            return new SettlementStatus(
                    account,
                    period,
                    ledger.isSettled(account, period, SettlementKind.FEE),
                    ledger.isSettled(account, period, SettlementKind.PAYOUT));
        });
    }

    /**
     * Whether the caller's class is the one the action requires.
     */
    public static boolean callerClassMatchesRequired(Classification classification, ParticipantKind required) {
        return classification.getKind() == required;
    }

    private Settlement settle(String caller, SettlementKind kind, BigDecimal suppliedValue) {
        requireAccount(caller);
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, caller);

        log.info("Attempting {} settlement", kind);

        settingsLock.readLock().lock();
        try {
            Classification classification = oracleClient.classify(caller);
            oracleClient.requireUnexpired(caller, classification);

            if (!callerClassMatchesRequired(classification, kind.requiredClass())) {
                throw new WrongParticipantClassException(kind.requiredClass(), classification.getKind());
            }
            if (classification.isSuspended()) {
                throw new SuspendedParticipantException(caller);
            }

            Period period = periodState.current();
            Settlement settlement = settleSlot(caller, period, kind, suppliedValue);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement(kind.name(), "success");
            log.info("{} settled: period={}, amount={}, duration={}ms",
                    kind, period.label(), settlement.getAmount(), duration);
            return settlement;

        } catch (LedgerException e) {
            metrics.recordSettlement(kind.name(), e.getCode());
            log.warn("{} rejected: code={}, reason={}", kind, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordSettlement(kind.name(), "error");
            log.error("{} failed unexpectedly: error={}", kind, e.getMessage(), e);
            throw e;
        } finally {
            settingsLock.readLock().unlock();
            metrics.recordLatency(kind.name().toLowerCase(), System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private Settlement settleSlot(String caller, Period period, SettlementKind kind, BigDecimal suppliedValue) {
        Lock stripe = stripeFor(caller, kind);
        stripe.lock();
        try {
            if (ledger.isSettled(caller, period, kind)) {
                throw new AlreadySettledException(caller, period, kind);
            }

            BigDecimal amount;
            if (kind == SettlementKind.FEE) {
                amount = requireExactFee(suppliedValue);
            } else {
                amount = adminConfig.getPayoutAmount();
            }

            transfer(caller, kind, amount);

            // Commit last: nobody may observe a settled slot whose funds did not move
            try {
                ledger.markSettled(caller, period, kind);
            } catch (RuntimeException e) {
                reverseTransfer(caller, kind, amount);
                throw new TransferFailedException(caller, amount,
                        "settlement could not be recorded, transfer reversed", e);
            }

            return new Settlement(caller, period, kind, amount, clock.instant());
        } finally {
            stripe.unlock();
        }
    }

    private BigDecimal requireExactFee(BigDecimal suppliedValue) {
        BigDecimal feeAmount = adminConfig.getFeeAmount();
        if (suppliedValue == null || suppliedValue.compareTo(feeAmount) != 0) {
            throw new IncorrectAmountException(feeAmount, suppliedValue);
        }
        return feeAmount;
    }

    private void transfer(String caller, SettlementKind kind, BigDecimal amount) {
        boolean transferred;
        try {
            transferred = kind == SettlementKind.FEE
                    ? fundsTransfer.retain(caller, amount)
                    : fundsTransfer.send(caller, amount);
        } catch (RuntimeException e) {
            throw new TransferFailedException(caller, amount, e.getMessage(), e);
        }
        if (!transferred) {
            throw new TransferFailedException(caller, amount, "transfer rejected");
        }
    }

    /**
     * Undoes a transfer whose settlement could not be recorded. Runs under the
     * slot's stripe lock, so no other call for the slot sees the moved funds.
     */
    private void reverseTransfer(String caller, SettlementKind kind, BigDecimal amount) {
        boolean reversed;
        try {
            reversed = kind == SettlementKind.FEE
                    ? fundsTransfer.refund(caller, amount)
                    : fundsTransfer.reclaim(caller, amount);
        } catch (RuntimeException e) {
            log.error("Reversal failed: kind={}, amount={}, error={}", kind, amount, e.getMessage(), e);
            reversed = false;
        }
        if (reversed) {
            log.warn("{} transfer reversed after failed ledger commit: amount={}", kind, amount);
        } else {
            log.error("{} transfer NOT reversed, needs manual reconciliation: account={}, amount={}",
                    kind, caller, amount);
            metrics.recordSettlement(kind.name(), "reversal_failed");
        }
    }

    private Lock stripeFor(String account, SettlementKind kind) {
        return stripes[Math.floorMod(Objects.hash(account, kind), LOCK_STRIPES)];
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("Account is required");
        }
        if (account.length() > PaymentLedger.MAX_ACCOUNT_LENGTH) {
            throw new IllegalArgumentException(
                    "Account must be at most " + PaymentLedger.MAX_ACCOUNT_LENGTH + " characters");
        }
    }
}
