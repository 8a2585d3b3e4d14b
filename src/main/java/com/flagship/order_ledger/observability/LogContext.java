package com.flagship.order_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys written to every log line, and helpers that scope them.
 *
 * Request scope: correlation ID and tenant, set by {@link CorrelationIdFilter}.
 * Posting scope: the payment number being written, set while one payment and
 * its journal are posted.
 */
public final class LogContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String TENANT_ID_HEADER = "X-Tenant-ID";

    static final String CORRELATION_ID_KEY = "correlationId";
    static final String TENANT_ID_KEY = "tenantId";
    static final String PAYMENT_NUMBER_KEY = "paymentNumber";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    private LogContext() {
    }

    /**
     * Keeps a caller-supplied correlation ID when it is usable, otherwise makes a short one.
     */
    static String correlationIdFrom(String header) {
        if (header == null || header.isBlank() || header.length() > MAX_CORRELATION_ID_LENGTH) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
        return header.trim();
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    /**
     * Tags log lines with the payment being posted until the returned handle is closed.
     */
    public static MDC.MDCCloseable postingPayment(String paymentNumber) {
        return MDC.putCloseable(PAYMENT_NUMBER_KEY, paymentNumber);
    }
}
