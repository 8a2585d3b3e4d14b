package com.flagship.order_ledger.payment;

import com.flagship.order_ledger.observability.LedgerMetrics;
import com.flagship.order_ledger.payment.SubmissionReport.ItemResult;
import com.flagship.order_ledger.payment.SubmissionReport.ItemStatus;
import com.flagship.order_ledger.payment.dto.PaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts the payments of one allocation one after another.
 *
 * Each payment is its own database transaction. The first failure stops the
 * run; later payments are reported as NOT_ATTEMPTED. Every payment is stored
 * under {@code <idempotencyKey>:<invoiceId>}, so resubmitting the same batch
 * with the same key only posts what is still missing.
 *
 * Must not run inside a surrounding transaction: each item commits on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSubmissionService {

    private final PaymentPostingGateway postingGateway;
    private final IdempotencyService idempotencyService;
    private final PaymentPersistenceService persistenceService;
    private final LedgerMetrics metrics;

    public SubmissionReport submit(UUID tenantId, List<Payment> payments, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        List<ItemResult> items = new ArrayList<>(payments.size());
        boolean failed = false;

        for (Payment payment : payments) {
            UUID invoiceId = payment.getInvoiceId();
            if (failed) {
                items.add(record(new ItemResult(invoiceId, ItemStatus.NOT_ATTEMPTED, PaymentResponse.from(payment), null)));
                continue;
            }

            String shareKey = IdempotencyService.shareKey(idempotencyKey, invoiceId);
            try {
                Optional<Payment> existing = findPosted(tenantId, shareKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Payment for invoice {} already posted as {}", invoiceId, existing.get().getPaymentNumber());
                    items.add(record(new ItemResult(invoiceId, ItemStatus.ALREADY_POSTED,
                        PaymentResponse.from(existing.get()), null)));
                    continue;
                }
                metrics.recordIdempotencyMiss();

                Payment posted = metrics.timePosting(() -> postingGateway.postPayment(tenantId, payment, shareKey));
                idempotencyService.storeIdempotencyKey(shareKey, posted.getId());
                items.add(record(new ItemResult(invoiceId, ItemStatus.SUCCEEDED, PaymentResponse.from(posted), null)));
            } catch (RuntimeException e) {
                log.error("Posting payment for invoice {} failed, {} remaining payments not attempted: {}",
                    invoiceId, payments.size() - items.size() - 1, e.getMessage());
                items.add(record(new ItemResult(invoiceId, ItemStatus.FAILED, PaymentResponse.from(payment), e.getMessage())));
                failed = true;
            }
        }

        SubmissionReport report = new SubmissionReport(items);
        log.info("Submitted {} payments: succeeded={}, already_posted={}, failed={}, not_attempted={}",
            items.size(), report.count(ItemStatus.SUCCEEDED), report.count(ItemStatus.ALREADY_POSTED),
            report.count(ItemStatus.FAILED), report.count(ItemStatus.NOT_ATTEMPTED));
        return report;
    }

    /**
     * Shares of an earlier submission under the same key, by invoice id.
     * A retried batch uses these instead of allocating those invoices again.
     */
    public Map<UUID, Payment> findPostedShares(UUID tenantId, List<UUID> invoiceIds, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        Map<UUID, Payment> posted = new LinkedHashMap<>();
        for (UUID invoiceId : invoiceIds) {
            findPosted(tenantId, IdempotencyService.shareKey(idempotencyKey, invoiceId))
                .ifPresent(payment -> posted.put(invoiceId, payment));
        }
        return posted;
    }

    private Optional<Payment> findPosted(UUID tenantId, String shareKey) {
        return idempotencyService.checkIdempotencyKey(shareKey)
            .flatMap(paymentId -> persistenceService.findById(tenantId, paymentId));
    }

    private ItemResult record(ItemResult item) {
        metrics.recordSubmissionItem(item.getStatus().name());
        return item;
    }
}
