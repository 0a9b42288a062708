package com.flagship.period_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for pointing the ledger at another identity oracle.
 * Blank references are rejected by the domain as INVALID_REFERENCE.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OracleReferenceRequest {

    @JsonProperty("reference")
    private String reference;
}
