package com.flagship.period_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.period_ledger.admin.SettingsSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SettingsResponse {

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("payout_amount")
    BigDecimal payoutAmount;

    @JsonProperty("oracle_reference")
    String oracleReference;

    @JsonProperty("month")
    int month;

    @JsonProperty("year")
    int year;

    public static SettingsResponse from(SettingsSnapshot snapshot) {
        return SettingsResponse.builder()
            .feeAmount(snapshot.getFeeAmount())
            .payoutAmount(snapshot.getPayoutAmount())
            .oracleReference(snapshot.getOracleReference())
            .month(snapshot.getPeriod().getMonth())
            .year(snapshot.getPeriod().getYear())
            .build();
    }
}
