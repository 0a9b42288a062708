package com.flagship.period_ledger.config;

import com.flagship.period_ledger.admin.AccessControl;
import com.flagship.period_ledger.admin.AdminConfig;
import com.flagship.period_ledger.admin.AdministrationService;
import com.flagship.period_ledger.admin.ConfiguredAccessControl;
import com.flagship.period_ledger.admin.SettingsLock;
import com.flagship.period_ledger.eligibility.EligibilityOracleClient;
import com.flagship.period_ledger.eligibility.HttpIdentityOracle;
import com.flagship.period_ledger.eligibility.IdentityOracle;
import com.flagship.period_ledger.event.LedgerEventPublisher;
import com.flagship.period_ledger.event.LoggingLedgerEventPublisher;
import com.flagship.period_ledger.ledger.InMemoryPaymentLedger;
import com.flagship.period_ledger.ledger.JdbcPaymentLedger;
import com.flagship.period_ledger.ledger.PaymentLedger;
import com.flagship.period_ledger.observability.LedgerMetrics;
import com.flagship.period_ledger.payment.PaymentGateway;
import com.flagship.period_ledger.period.Period;
import com.flagship.period_ledger.period.PeriodState;
import com.flagship.period_ledger.treasury.FundsTransfer;
import com.flagship.period_ledger.treasury.Treasury;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.YearMonth;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the ledger core from {@link LedgerProperties}.
 *
 * The core classes are plain objects so tests can build independent
 * instances; this class is the only place they meet Spring.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SettingsLock settingsLock() {
        return new SettingsLock();
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry registry) {
        return new LedgerMetrics(registry);
    }

    @Bean
    public AccessControl accessControl(LedgerProperties properties) {
        if (properties.getAdmin().getAccounts().isEmpty()) {
            log.warn("No administrative accounts configured (ledger.admin.accounts); settings are read-only");
        }
        return new ConfiguredAccessControl(properties.getAdmin().getAccounts());
    }

    @Bean
    @ConditionalOnProperty(name = "events.kafka.enabled", havingValue = "false")
    public LedgerEventPublisher loggingLedgerEventPublisher() {
        return new LoggingLedgerEventPublisher();
    }

    @Bean
    public AdminConfig adminConfig(AccessControl accessControl,
                                   SettingsLock settingsLock,
                                   LedgerEventPublisher eventPublisher,
                                   LedgerProperties properties,
                                   Clock clock) {
        return new AdminConfig(accessControl, settingsLock, eventPublisher,
                properties.getFeeAmount(),
                properties.getPayoutAmount(),
                properties.getOracle().getReference(),
                clock);
    }

    @Bean
    public PeriodState periodState(AccessControl accessControl,
                                   SettingsLock settingsLock,
                                   LedgerEventPublisher eventPublisher,
                                   LedgerProperties properties,
                                   Clock clock) {
        LedgerProperties.PeriodSettings settings = properties.getPeriod();
        YearMonth now = YearMonth.now(clock);
        Period initial = Period.of(
                settings.getInitialMonth() != null ? settings.getInitialMonth() : now.getMonthValue(),
                settings.getInitialYear() != null ? settings.getInitialYear() : now.getYear());

        log.info("Starting with period {} (epoch floor year {})", initial.label(), settings.getEpochFloorYear());
        return new PeriodState(accessControl, settingsLock, eventPublisher, settings.getEpochFloorYear(), initial,
                clock);
    }

    @Bean
    public AdministrationService administrationService(AdminConfig adminConfig,
                                                       PeriodState periodState,
                                                       SettingsLock settingsLock,
                                                       LedgerMetrics metrics) {
        return new AdministrationService(adminConfig, periodState, settingsLock, metrics);
    }

    @Bean
    public RestTemplate oracleRestTemplate(RestTemplateBuilder builder, LedgerProperties properties) {
        return builder
                .setConnectTimeout(properties.getOracle().getConnectTimeout())
                .setReadTimeout(properties.getOracle().getTimeout())
                .build();
    }

    @Bean
    public IdentityOracle identityOracle(RestTemplate oracleRestTemplate) {
        return new HttpIdentityOracle(oracleRestTemplate);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService oracleExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public EligibilityOracleClient eligibilityOracleClient(IdentityOracle identityOracle,
                                                           AdminConfig adminConfig,
                                                           ExecutorService oracleExecutor,
                                                           LedgerProperties properties,
                                                           Clock clock) {
        return new EligibilityOracleClient(identityOracle, adminConfig, oracleExecutor,
                properties.getOracle().getTimeout(), clock);
    }

    @Bean
    public Treasury treasury(LedgerProperties properties) {
        return new Treasury(properties.getTreasury().getInitialBalance());
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store", havingValue = "memory")
    public PaymentLedger inMemoryPaymentLedger() {
        log.warn("Using in-memory payment ledger; settlements are lost on restart");
        return new InMemoryPaymentLedger();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store", havingValue = "jdbc", matchIfMissing = true)
    public PaymentLedger jdbcPaymentLedger(JdbcTemplate jdbcTemplate) {
        return new JdbcPaymentLedger(jdbcTemplate);
    }

    @Bean
    public PaymentGateway paymentGateway(EligibilityOracleClient eligibilityOracleClient,
                                         PaymentLedger paymentLedger,
                                         PeriodState periodState,
                                         AdminConfig adminConfig,
                                         FundsTransfer treasury,
                                         SettingsLock settingsLock,
                                         LedgerMetrics metrics,
                                         Clock clock) {
        return new PaymentGateway(eligibilityOracleClient, paymentLedger, periodState, adminConfig,
                treasury, settingsLock, metrics, clock);
    }
}
