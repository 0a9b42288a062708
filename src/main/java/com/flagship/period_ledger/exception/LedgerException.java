package com.flagship.period_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every domain failure raised by the ledger.
 *
 * Each failure carries a stable machine-readable code, its category, and a
 * small map of details that is rendered verbatim in API error responses.
 */
public abstract class LedgerException extends RuntimeException {

    private final String code;
    private final ErrorCategory category;
    private final Map<String, String> details;

    protected LedgerException(String code, ErrorCategory category, String message,
                              Map<String, String> details) {
        this(code, category, message, details, null);
    }

    protected LedgerException(String code, ErrorCategory category, String message,
                              Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.category = category;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    static Map<String, String> detail(String key, Object value) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put(key, String.valueOf(value));
        return details;
    }

    static Map<String, String> detail(String key1, Object value1, String key2, Object value2) {
        Map<String, String> details = detail(key1, value1);
        details.put(key2, String.valueOf(value2));
        return details;
    }
}
