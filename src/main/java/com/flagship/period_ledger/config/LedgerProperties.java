package com.flagship.period_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Startup settings under the {@code ledger} prefix.
 *
 * These seed the live configuration; afterwards fee, payout, oracle reference
 * and period change only through the administrative API.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    @NotNull
    @Positive
    private BigDecimal feeAmount;

    @NotNull
    @Positive
    private BigDecimal payoutAmount;

    /**
     * {@code jdbc} (default) or {@code memory}.
     */
    private String store = "jdbc";

    @Valid
    private Oracle oracle = new Oracle();

    @Valid
    private PeriodSettings period = new PeriodSettings();

    private Admin admin = new Admin();

    @Valid
    private TreasurySettings treasury = new TreasurySettings();

    @Data
    public static class Oracle {
        @NotBlank
        private String reference;
        private Duration timeout = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class PeriodSettings {
        private int epochFloorYear = 2000;
        @Min(1)
        @Max(12)
        private Integer initialMonth;
        private Integer initialYear;
    }

    @Data
    public static class Admin {
        private Set<String> accounts = new LinkedHashSet<>();
    }

    @Data
    public static class TreasurySettings {
        @PositiveOrZero
        private BigDecimal initialBalance = BigDecimal.ZERO;
    }
}
