package com.flagship.period_ledger.payment;

import com.flagship.period_ledger.payment.dto.FeePaymentRequest;
import com.flagship.period_ledger.payment.dto.SettlementResponse;
import com.flagship.period_ledger.payment.dto.SettlementStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for the participant actions.
 *
 * The caller is identified by the {@code X-Account-Id} header. Failures are
 * rendered by {@link com.flagship.period_ledger.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    public static final String ACCOUNT_ID_HEADER = "X-Account-Id";

    private final PaymentGateway paymentGateway;

    /**
     * Pays the fee for the current period.
     */
    @PostMapping("/fee")
    public ResponseEntity<SettlementResponse> payFee(
            @RequestHeader(ACCOUNT_ID_HEADER) String accountId,
            @Valid @RequestBody FeePaymentRequest request) {
        Settlement settlement = paymentGateway.collectFee(accountId, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementResponse.from(settlement));
    }

    /**
     * Claims the payout for the current period.
     */
    @PostMapping("/payout")
    public ResponseEntity<SettlementResponse> claimPayout(@RequestHeader(ACCOUNT_ID_HEADER) String accountId) {
        Settlement settlement = paymentGateway.disburse(accountId);
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementResponse.from(settlement));
    }

    @GetMapping("/status")
    public ResponseEntity<SettlementStatusResponse> status(@RequestHeader(ACCOUNT_ID_HEADER) String accountId) {
        return ResponseEntity.ok(SettlementStatusResponse.from(paymentGateway.settlementStatus(accountId)));
    }
}
