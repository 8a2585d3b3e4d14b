package com.flagship.order_ledger.allocation;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.invoice.Invoice;
import com.flagship.order_ledger.invoice.PendingAmountCalculator;
import com.flagship.order_ledger.payment.Payment;
import com.flagship.order_ledger.payment.PaymentType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Splits one payment across several invoices of the same customer or supplier.
 *
 * The allocator is pure: it works on the invoice snapshot it is given, writes
 * nothing and returns the same split for the same input. Posting the resulting
 * payments is left to {@link com.flagship.order_ledger.payment.PaymentSubmissionService}.
 *
 * Rules:
 * 1. Every requested amount must satisfy 0 < requested <= pending(invoice)
 * 2. The advance is shared in proportion to each invoice's pending amount,
 *    capped at the invoice's requested amount
 * 3. Each invoice's cash portion is requested - advanceShare
 * 4. A payment account is required whenever any cash is paid
 *
 * Advance shares are rounded down to the cent, so the advance applied never
 * exceeds the advance offered.
 */
@Component
@RequiredArgsConstructor
public class PaymentAllocator {

    private final PendingAmountCalculator pendingAmountCalculator;

    /**
     * Validates the selection against the invoice snapshot and builds one unposted
     * payment per selected invoice.
     *
     * @param request  the selection, advance draw and payment account
     * @param invoices current snapshot of the counterparty's invoices
     * @return the split, in selection order
     * @throws AllocationValidationException if any selection or amount is invalid;
     *                                       nothing is allocated in that case
     */
    public AllocationResult allocate(AllocationRequest request, List<Invoice> invoices) {
        Map<UUID, Invoice> invoicesById = invoices.stream()
            .collect(Collectors.toMap(Invoice::getId, Function.identity(), (first, second) -> first));

        Map<String, String> violations = new LinkedHashMap<>();
        Map<UUID, BigDecimal> pendingByInvoice = validateSelections(request, invoicesById, violations);

        BigDecimal advanceUsed = Amounts.normalize(request.getAdvanceUsed());
        validateAdvance(request, advanceUsed, violations);

        if (!violations.isEmpty()) {
            throw new AllocationValidationException(violations);
        }

        BigDecimal totalRequested = request.getSelections().stream()
            .map(selection -> Amounts.normalize(selection.getRequestedAmount()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalRequested.add(advanceUsed).signum() <= 0) {
            throw AllocationValidationException.of("selections", "Total payment must be greater than 0");
        }
        if (advanceUsed.compareTo(totalRequested) > 0) {
            throw AllocationValidationException.of("advance_used",
                String.format("Advance %s exceeds the total requested amount %s", advanceUsed, totalRequested));
        }

        BigDecimal pendingTotal = pendingByInvoice.values().stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<Payment> payments = new ArrayList<>(request.getSelections().size());
        BigDecimal totalCash = BigDecimal.ZERO;
        BigDecimal advanceApplied = BigDecimal.ZERO;

        for (InvoiceSelection selection : request.getSelections()) {
            BigDecimal requested = Amounts.normalize(selection.getRequestedAmount());
            BigDecimal advanceShare = advanceShare(
                requested, pendingByInvoice.get(selection.getInvoiceId()), pendingTotal, advanceUsed);
            BigDecimal cashPortion = requested.subtract(advanceShare);

            payments.add(buildPayment(request, selection.getInvoiceId(), cashPortion, advanceShare));
            totalCash = totalCash.add(cashPortion);
            advanceApplied = advanceApplied.add(advanceShare);
        }

        if (totalCash.signum() > 0 && request.getPaymentAccountId() == null) {
            throw AllocationValidationException.of("payment_account_id",
                String.format("Payment account is required for a cash payment of %s", totalCash));
        }

        return new AllocationResult(
            payments,
            totalRequested,
            totalCash,
            advanceApplied,
            advanceUsed.subtract(advanceApplied)
        );
    }

    private Map<UUID, BigDecimal> validateSelections(AllocationRequest request,
                                                     Map<UUID, Invoice> invoicesById,
                                                     Map<String, String> violations) {
        Map<UUID, BigDecimal> pendingByInvoice = new LinkedHashMap<>();
        List<InvoiceSelection> selections = request.getSelections();
        if (selections == null || selections.isEmpty()) {
            violations.put("selections", "At least one invoice must be selected");
            return pendingByInvoice;
        }

        Set<UUID> seen = new HashSet<>();
        for (InvoiceSelection selection : selections) {
            if (selection == null) {
                violations.put("selections", "Selection cannot be empty");
                continue;
            }
            UUID invoiceId = selection.getInvoiceId();
            if (invoiceId == null) {
                violations.put("selections", "Invoice ID is required");
                continue;
            }
            String key = invoiceId.toString();
            if (!seen.add(invoiceId)) {
                violations.put(key, "Invoice selected more than once");
                continue;
            }

            Invoice invoice = invoicesById.get(invoiceId);
            if (invoice == null || !belongsTo(invoice, request)) {
                violations.put(key, "Invoice not found for this " + roleName(request.getEntityRole()));
                continue;
            }

            BigDecimal pending = pendingAmountCalculator.calculatePendingAmount(invoice);
            pendingByInvoice.put(invoiceId, pending);

            BigDecimal requested = selection.getRequestedAmount();
            if (requested == null || requested.signum() <= 0) {
                violations.put(key, "Amount must be greater than 0");
            } else if (requested.compareTo(pending) > 0) {
                violations.put(key, String.format(
                    "Amount %s exceeds pending amount %s on invoice %s",
                    requested, pending, invoice.getInvoiceNumber()));
            }
        }
        return pendingByInvoice;
    }

    private void validateAdvance(AllocationRequest request, BigDecimal advanceUsed, Map<String, String> violations) {
        if (advanceUsed.signum() < 0) {
            violations.put("advance_used", "Advance used cannot be negative");
        } else if (request.getAvailableAdvance() != null
                && advanceUsed.compareTo(request.getAvailableAdvance()) > 0) {
            violations.put("advance_used", String.format(
                "Advance %s exceeds available advance %s", advanceUsed, request.getAvailableAdvance()));
        }
    }

    /**
     * min(requested, pending / pendingTotal * advanceUsed), rounded down to the cent.
     */
    static BigDecimal advanceShare(BigDecimal requested, BigDecimal pending,
                                   BigDecimal pendingTotal, BigDecimal advanceUsed) {
        if (advanceUsed.signum() <= 0 || pendingTotal.signum() <= 0) {
            return BigDecimal.ZERO.setScale(Amounts.SCALE);
        }
        BigDecimal proportional = pending.multiply(advanceUsed)
            .divide(pendingTotal, Amounts.SCALE, RoundingMode.DOWN);
        return proportional.min(requested);
    }

    private Payment buildPayment(AllocationRequest request, UUID invoiceId,
                                 BigDecimal cashPortion, BigDecimal advanceShare) {
        boolean customer = request.getEntityRole() == EntityRole.CUSTOMER;
        return Payment.builder()
            .date(request.getPaymentDate())
            .type(customer ? PaymentType.CUSTOMER_PAYMENT : PaymentType.SUPPLIER_PAYMENT)
            .amount(cashPortion)
            .accountId(cashPortion.signum() > 0 ? request.getPaymentAccountId() : null)
            .customerId(customer ? request.getEntityId() : null)
            .supplierId(customer ? null : request.getEntityId())
            .orderId(customer ? invoiceId : null)
            .purchaseInvoiceId(customer ? null : invoiceId)
            .useAdvanceBalance(advanceShare.signum() > 0)
            .advanceAmountUsed(advanceShare)
            .build();
    }

    private static boolean belongsTo(Invoice invoice, AllocationRequest request) {
        return (invoice.getEntityRole() == null || invoice.getEntityRole() == request.getEntityRole())
            && (invoice.getEntityId() == null || invoice.getEntityId().equals(request.getEntityId()));
    }

    private static String roleName(EntityRole role) {
        return role == null ? "counterparty" : role.name().toLowerCase();
    }
}
