package com.flagship.period_ledger.eligibility;

import com.flagship.period_ledger.eligibility.dto.ClassificationPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;

/**
 * Identity oracle reached over HTTP at
 * {@code GET {reference}/accounts/{account}/classification}.
 *
 * The RestTemplate is expected to carry connect and read timeouts.
 */
@Slf4j
public class HttpIdentityOracle implements IdentityOracle {

    static final String CLASSIFICATION_PATH = "/accounts/{account}/classification";

    private final RestTemplate restTemplate;

    public HttpIdentityOracle(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Classification classify(String oracleReference, String account) {
        String base = oracleReference.endsWith("/")
                ? oracleReference.substring(0, oracleReference.length() - 1)
                : oracleReference;

        ClassificationPayload payload =
                restTemplate.getForObject(base + CLASSIFICATION_PATH, ClassificationPayload.class, account);

        log.debug("Oracle answered for account {}: {}", account, payload);
        return payload != null ? payload.toDomain() : null;
    }
}
