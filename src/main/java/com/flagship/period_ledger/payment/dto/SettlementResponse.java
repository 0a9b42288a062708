package com.flagship.period_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.period_ledger.ledger.SettlementKind;
import com.flagship.period_ledger.payment.Settlement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("kind")
    SettlementKind kind;

    @JsonProperty("month")
    int month;

    @JsonProperty("year")
    int year;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static SettlementResponse from(Settlement settlement) {
        return SettlementResponse.builder()
            .accountId(settlement.getAccount())
            .kind(settlement.getKind())
            .month(settlement.getPeriod().getMonth())
            .year(settlement.getPeriod().getYear())
            .amount(settlement.getAmount())
            .settledAt(settlement.getSettledAt())
            .build();
    }
}
