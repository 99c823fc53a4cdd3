package com.cidery.ledger.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type of every failure raised by the production ledger.
 * Carries a machine readable code and a details map for the caller.
 */
public abstract class LedgerException extends RuntimeException {

    private final String code;
    private final Map<String, Object> details;

    protected LedgerException(String code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    protected LedgerException(String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public abstract ErrorCategory getCategory();

    public boolean isRetryable() {
        return getCategory() == ErrorCategory.CONFLICT;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
