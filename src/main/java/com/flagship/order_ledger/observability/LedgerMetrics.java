package com.flagship.order_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for allocation, payment submission and fee evaluation.
 *
 * Metrics exposed:
 * - allocation.requests{result}: allocations accepted or rejected
 * - payment.submission.items{status}: submitted shares by outcome
 * - payment.posting.duration: time to post one payment with its journal
 * - idempotency.cache{result}: hit / miss on idempotency lookups
 * - fee.evaluations{mode}: fee rule evaluations
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer postingTimer;
    private final Counter allocationsAccepted;
    private final Counter allocationsRejected;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingTimer = Timer.builder("payment.posting.duration")
                .description("Time taken to post one payment and its journal transaction")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.allocationsAccepted = Counter.builder("allocation.requests")
                .tag("result", "accepted")
                .description("Payment allocations that passed validation")
                .register(registry);

        this.allocationsRejected = Counter.builder("allocation.requests")
                .tag("result", "rejected")
                .description("Payment allocations rejected by validation")
                .register(registry);
    }

    public void recordAllocation(boolean accepted) {
        (accepted ? allocationsAccepted : allocationsRejected).increment();
    }

    public void recordSubmissionItem(String status) {
        registry.counter("payment.submission.items", "status", sanitizeTag(status)).increment();
    }

    public <T> T timePosting(Supplier<T> operation) {
        return postingTimer.record(operation);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordFeeEvaluation(String mode) {
        registry.counter("fee.evaluations", "mode", sanitizeTag(mode)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
