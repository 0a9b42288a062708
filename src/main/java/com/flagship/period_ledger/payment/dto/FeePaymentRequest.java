package com.flagship.period_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for paying the period fee. The amount must equal the configured
 * fee exactly; that rule is enforced by the gateway, not here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeePaymentRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;
}
