package com.flagship.order_ledger.fee;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a fee rule table or fee configuration is malformed.
 *
 * violations maps the offending field, e.g. {@code rules[1].max}, to the reason.
 */
@Getter
public class FeeRuleValidationException extends RuntimeException {

    private final Map<String, String> violations;

    public FeeRuleValidationException(Map<String, String> violations) {
        super("Invalid fee rules: " + violations);
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    public static FeeRuleValidationException of(String key, String reason) {
        return new FeeRuleValidationException(Map.of(key, reason));
    }
}
