package com.flagship.period_ledger.eligibility;

import com.flagship.period_ledger.admin.AdminConfig;
import com.flagship.period_ledger.exception.AttributeExpiredException;
import com.flagship.period_ledger.exception.OracleUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the identity oracle configured in {@link AdminConfig} under a deadline.
 *
 * Any failure to obtain a complete answer in time surfaces as
 * {@link OracleUnavailableException}. The caller's MDC (correlation id,
 * account id) is carried onto the executor thread. Suspension is reported, not enforced:
 * the gateway decides what a suspended classification means.
 */
@Slf4j
public class EligibilityOracleClient {

    private final IdentityOracle oracle;
    private final AdminConfig adminConfig;
    private final Executor executor;
    private final Duration timeout;
    private final Clock clock;

    public EligibilityOracleClient(IdentityOracle oracle,
                                   AdminConfig adminConfig,
                                   Executor executor,
                                   Duration timeout,
                                   Clock clock) {
        this.oracle = oracle;
        this.adminConfig = adminConfig;
        this.executor = executor;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Fetches a fresh classification for the account.
     *
     * @throws OracleUnavailableException if the oracle fails, times out or answers incompletely
     */
    public Classification classify(String account) {
        String reference = adminConfig.getOracleReference();
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        CompletableFuture<Classification> call =
                CompletableFuture.supplyAsync(() -> classifyWithContext(callerContext, reference, account), executor);

        Classification classification;
        try {
            classification = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Oracle call timed out after {}ms: oracle={}", timeout.toMillis(), reference);
            throw new OracleUnavailableException(account, "no response within " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Oracle call failed: oracle={}, error={}", reference, cause.getMessage());
            throw new OracleUnavailableException(account, cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new OracleUnavailableException(account, "interrupted", e);
        }

        if (classification == null || classification.getKind() == null || classification.getExpiresAt() == null) {
            throw new OracleUnavailableException(account, "incomplete classification");
        }
        log.debug("Classified account: kind={}, expiresAt={}, suspended={}",
                classification.getKind(), classification.getExpiresAt(), classification.isSuspended());
        return classification;
    }

    private Classification classifyWithContext(Map<String, String> callerContext, String reference, String account) {
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        try {
            return oracle.classify(reference, account);
        } finally {
            MDC.clear();
        }
    }

    /**
     * @throws AttributeExpiredException unless the classification expires strictly after now
     */
    public void requireUnexpired(String account, Classification classification) {
        if (!classification.isValidAt(clock.instant())) {
            throw new AttributeExpiredException(account, classification.getExpiresAt());
        }
    }
}
