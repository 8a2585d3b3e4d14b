package com.flagship.order_ledger.invoice;

import com.flagship.order_ledger.common.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives how much of an invoice is still outstanding.
 *
 * Only one payment source is used per invoice so that an invoice carrying both
 * linked payments and a legacy paymentAmount is never counted twice.
 * The result is never negative: an overpaid invoice is simply settled.
 */
@Component
public class PendingAmountCalculator {

    public BigDecimal calculatePendingAmount(Invoice invoice) {
        BigDecimal pending = Amounts.orZero(invoice.getTotalAmount()).subtract(totalPaid(invoice));
        return Amounts.maxZero(Amounts.normalize(pending));
    }

    public BigDecimal totalPaid(Invoice invoice) {
        if (!invoice.getLinkedPayments().isEmpty()) {
            return Amounts.sum(invoice.getLinkedPayments());
        }
        if (!invoice.getEntityPayments().isEmpty()) {
            return Amounts.sum(invoice.getEntityPayments());
        }
        return Amounts.orZero(invoice.getLegacyPaymentAmount());
    }

    /**
     * Invoices that can still receive a payment (pending > 0).
     */
    public List<Invoice> payableInvoices(List<Invoice> invoices) {
        return invoices.stream()
                .filter(invoice -> calculatePendingAmount(invoice).signum() > 0)
                .collect(Collectors.toList());
    }
}
