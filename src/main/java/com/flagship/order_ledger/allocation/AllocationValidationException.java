package com.flagship.order_ledger.allocation;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a payment allocation is rejected before anything is written.
 *
 * violations maps the offending field name or invoice id to the reason.
 */
@Getter
public class AllocationValidationException extends RuntimeException {

    private final Map<String, String> violations;

    public AllocationValidationException(Map<String, String> violations) {
        super(buildMessage(violations));
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    public static AllocationValidationException of(String key, String reason) {
        return new AllocationValidationException(Map.of(key, reason));
    }

    private static String buildMessage(Map<String, String> violations) {
        StringBuilder message = new StringBuilder("Payment allocation rejected: ");
        violations.forEach((key, reason) -> message.append(key).append(" - ").append(reason).append("; "));
        return message.substring(0, message.length() - 2);
    }
}
