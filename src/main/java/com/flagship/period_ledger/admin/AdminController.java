package com.flagship.period_ledger.admin;

import com.flagship.period_ledger.admin.dto.AmountRequest;
import com.flagship.period_ledger.admin.dto.MonthRequest;
import com.flagship.period_ledger.admin.dto.OracleReferenceRequest;
import com.flagship.period_ledger.admin.dto.SettingsResponse;
import com.flagship.period_ledger.admin.dto.YearRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.flagship.period_ledger.payment.PaymentController.ACCOUNT_ID_HEADER;

/**
 * REST Controller for the administrative surface.
 *
 * Every command requires the administrative capability; each successful
 * command answers with the resulting settings.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final AdministrationService administrationService;

    @GetMapping("/config")
    public ResponseEntity<SettingsResponse> getSettings() {
        return ResponseEntity.ok(SettingsResponse.from(administrationService.snapshot()));
    }

    @PutMapping("/fee")
    public ResponseEntity<SettingsResponse> setFee(
            @RequestHeader(ACCOUNT_ID_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        log.info("Received fee change request: amount={}", request.getAmount());
        administrationService.setFee(caller, request.getAmount());
        return getSettings();
    }

    @PutMapping("/payout")
    public ResponseEntity<SettingsResponse> setPayout(
            @RequestHeader(ACCOUNT_ID_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        log.info("Received payout change request: amount={}", request.getAmount());
        administrationService.setPayout(caller, request.getAmount());
        return getSettings();
    }

    @PutMapping("/period/month")
    public ResponseEntity<SettingsResponse> setMonth(
            @RequestHeader(ACCOUNT_ID_HEADER) String caller,
            @Valid @RequestBody MonthRequest request) {
        administrationService.setMonth(caller, request.getMonth());
        return getSettings();
    }

    @PutMapping("/period/year")
    public ResponseEntity<SettingsResponse> setYear(
            @RequestHeader(ACCOUNT_ID_HEADER) String caller,
            @Valid @RequestBody YearRequest request) {
        administrationService.setYear(caller, request.getYear());
        return getSettings();
    }

    @PutMapping("/oracle")
    public ResponseEntity<SettingsResponse> setOracleReference(
            @RequestHeader(ACCOUNT_ID_HEADER) String caller,
            @RequestBody OracleReferenceRequest request) {
        administrationService.setOracleReference(caller, request.getReference());
        return getSettings();
    }
}
