package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.observability.LedgerMetrics;
import com.flagship.period_ledger.period.PeriodState;

import java.math.BigDecimal;

/**
 * Administrative surface: one entry point for every settings command and the
 * settings read model.
 */
public class AdministrationService {

    private final AdminConfig adminConfig;
    private final PeriodState periodState;
    private final SettingsLock settingsLock;
    private final LedgerMetrics metrics;

    public AdministrationService(AdminConfig adminConfig,
                                 PeriodState periodState,
                                 SettingsLock settingsLock,
                                 LedgerMetrics metrics) {
        this.adminConfig = adminConfig;
        this.periodState = periodState;
        this.settingsLock = settingsLock;
        this.metrics = metrics;
    }

    public void setFee(String caller, BigDecimal amount) {
        adminConfig.setFee(caller, amount);
        metrics.recordSettingChanged("fee_amount");
    }

    public void setPayout(String caller, BigDecimal amount) {
        adminConfig.setPayout(caller, amount);
        metrics.recordSettingChanged("payout_amount");
    }

    public void setMonth(String caller, int month) {
        periodState.setMonth(caller, month);
        metrics.recordSettingChanged("month");
    }

    public void setYear(String caller, int year) {
        periodState.setYear(caller, year);
        metrics.recordSettingChanged("year");
    }

    public void setOracleReference(String caller, String reference) {
        adminConfig.setOracleReference(caller, reference);
        metrics.recordSettingChanged("oracle_reference");
    }

    /**
     * Reads configuration and period under one read lock so the result never
     * mixes values from before and after a concurrent change.
     */
    public SettingsSnapshot snapshot() {
        return settingsLock.read(() -> new SettingsSnapshot(
                adminConfig.getFeeAmount(),
                adminConfig.getPayoutAmount(),
                adminConfig.getOracleReference(),
                periodState.current()));
    }
}
