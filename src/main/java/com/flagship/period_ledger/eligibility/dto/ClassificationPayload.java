package com.flagship.period_ledger.eligibility.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.period_ledger.eligibility.Classification;
import com.flagship.period_ledger.eligibility.ParticipantKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire format of the oracle's classification answer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassificationPayload {

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    @JsonProperty("suspended")
    private boolean suspended;

    public Classification toDomain() {
        return new Classification(ParticipantKind.fromOracleValue(kind), expiresAt, suspended);
    }
}
