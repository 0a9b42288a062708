package com.flagship.period_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.period_ledger.payment.SettlementStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SettlementStatusResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("month")
    int month;

    @JsonProperty("year")
    int year;

    @JsonProperty("fee_settled")
    boolean feeSettled;

    @JsonProperty("payout_settled")
    boolean payoutSettled;

    public static SettlementStatusResponse from(SettlementStatus status) {
        return SettlementStatusResponse.builder()
            .accountId(status.getAccount())
            .month(status.getPeriod().getMonth())
            .year(status.getPeriod().getYear())
            .feeSettled(status.isFeeSettled())
            .payoutSettled(status.isPayoutSettled())
            .build();
    }
}
