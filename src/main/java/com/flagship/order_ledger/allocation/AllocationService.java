package com.flagship.order_ledger.allocation;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.invoice.BalanceSnapshot;
import com.flagship.order_ledger.invoice.Invoice;
import com.flagship.order_ledger.invoice.InvoiceDirectory;
import com.flagship.order_ledger.observability.LedgerMetrics;
import com.flagship.order_ledger.payment.Payment;
import com.flagship.order_ledger.payment.PaymentSubmissionService;
import com.flagship.order_ledger.payment.SubmissionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Loads the counterparty's invoices and balance, runs the allocator on them
 * and, for a submission, posts the resulting payments.
 *
 * The advance cap always comes from the stored balance snapshot; a value sent
 * by the client is ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationService {

    private final InvoiceDirectory invoiceDirectory;
    private final PaymentAllocator allocator;
    private final PaymentSubmissionService submissionService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public AllocationResult preview(UUID tenantId, AllocationRequest request) {
        AllocationRequest resolved = resolve(tenantId, request);
        List<Invoice> invoices = invoiceDirectory.fetchInvoicesForEntity(
            tenantId, resolved.getEntityRole(), resolved.getEntityId());
        try {
            AllocationResult result = allocator.allocate(resolved, invoices);
            metrics.recordAllocation(true);
            return result;
        } catch (AllocationValidationException e) {
            metrics.recordAllocation(false);
            throw e;
        }
    }

    public Submission submit(UUID tenantId, AllocationRequest request, String idempotencyKey) {
        Map<UUID, Payment> posted = submissionService.findPostedShares(
            tenantId, selectedInvoiceIds(request), idempotencyKey);
        // a repeated invoice is left for the allocator to reject
        AllocationResult allocation = posted.isEmpty() || hasRepeatedInvoice(request)
            ? preview(tenantId, request)
            : resume(tenantId, request, posted);
        log.info("Submitting {} payments for {} {}: cash={}, advance={}",
            allocation.getPayments().size(), request.getEntityRole(), request.getEntityId(),
            allocation.getTotalCash(), allocation.getAdvanceApplied());
        SubmissionReport report = submissionService.submit(tenantId, allocation.getPayments(), idempotencyKey);
        return new Submission(allocation, report);
    }

    /**
     * Allocates only the invoices the earlier attempt did not post, with the advance
     * those shares already drew taken off. The stored shares keep their place in
     * selection order so the submission reports them as ALREADY_POSTED.
     */
    private AllocationResult resume(UUID tenantId, AllocationRequest request, Map<UUID, Payment> posted) {
        List<InvoiceSelection> remaining = request.getSelections().stream()
            .filter(selection -> selection == null || !posted.containsKey(selection.getInvoiceId()))
            .collect(Collectors.toList());
        BigDecimal postedAdvance = Amounts.sum(posted.values().stream()
            .map(Payment::getAdvanceAmountUsed)
            .collect(Collectors.toList()));
        BigDecimal remainingAdvance = Amounts.maxZero(Amounts.normalize(request.getAdvanceUsed()).subtract(postedAdvance));
        log.info("Resuming submission for {} {}: {} of {} shares already posted",
            request.getEntityRole(), request.getEntityId(), posted.size(), request.getSelections().size());

        Map<UUID, Payment> allocated = new HashMap<>();
        BigDecimal advanceUnused = remainingAdvance;
        if (!remaining.isEmpty()) {
            AllocationResult rest = preview(tenantId, request.toBuilder()
                .selections(remaining)
                .advanceUsed(remainingAdvance)
                .build());
            rest.getPayments().forEach(payment -> allocated.put(payment.getInvoiceId(), payment));
            advanceUnused = rest.getAdvanceUnused();
        }

        List<Payment> payments = request.getSelections().stream()
            .map(selection -> posted.getOrDefault(selection.getInvoiceId(), allocated.get(selection.getInvoiceId())))
            .collect(Collectors.toList());
        return new AllocationResult(
            payments,
            Amounts.sum(payments.stream().map(Payment::getSettledAmount).collect(Collectors.toList())),
            Amounts.sum(payments.stream().map(Payment::getAmount).collect(Collectors.toList())),
            Amounts.sum(payments.stream().map(Payment::getAdvanceAmountUsed).collect(Collectors.toList())),
            advanceUnused
        );
    }

    private static boolean hasRepeatedInvoice(AllocationRequest request) {
        Set<UUID> seen = new HashSet<>();
        return request.getSelections().stream()
            .filter(Objects::nonNull)
            .anyMatch(selection -> !seen.add(selection.getInvoiceId()));
    }

    private static List<UUID> selectedInvoiceIds(AllocationRequest request) {
        if (request.getSelections() == null) {
            return List.of();
        }
        return request.getSelections().stream()
            .filter(Objects::nonNull)
            .map(InvoiceSelection::getInvoiceId)
            .filter(Objects::nonNull)
            .distinct()
            .collect(Collectors.toList());
    }

    private AllocationRequest resolve(UUID tenantId, AllocationRequest request) {
        BalanceSnapshot snapshot = invoiceDirectory.fetchBalanceSnapshot(
            tenantId, request.getEntityRole(), request.getEntityId());
        LocalDate paymentDate = request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now(clock);
        return request.toBuilder()
            .paymentDate(paymentDate)
            .availableAdvance(snapshot.getAvailableAdvance())
            .build();
    }

    /**
     * An allocation together with the outcome of posting it.
     */
    @lombok.Value
    public static class Submission {
        AllocationResult allocation;
        SubmissionReport report;
    }
}
