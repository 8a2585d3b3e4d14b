package com.flagship.order_ledger.payment;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.invoice.Invoice;
import com.flagship.order_ledger.invoice.InvoiceDirectory;
import com.flagship.order_ledger.invoice.PendingAmountCalculator;
import com.flagship.order_ledger.ledger.AccountService;
import com.flagship.order_ledger.ledger.LedgerService;
import com.flagship.order_ledger.ledger.PaymentJournalBuilder;
import com.flagship.order_ledger.ledger.PostedTransaction;
import com.flagship.order_ledger.ledger.TransactionRequest;
import com.flagship.order_ledger.observability.LogContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Posts a payment and its journal transaction in one database transaction.
 *
 * The invoice row is locked first and its pending amount recomputed, so a
 * payment allocated against an older snapshot cannot overpay the invoice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPostingService implements PaymentPostingGateway {

    private final InvoiceDirectory invoiceDirectory;
    private final PendingAmountCalculator pendingAmountCalculator;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final PaymentJournalBuilder journalBuilder;
    private final PaymentPersistenceService persistenceService;

    @Override
    @Transactional
    public Payment postPayment(UUID tenantId, Payment payment, String idempotencyKey) {
        if (payment.isPosted()) {
            throw new IllegalStateException("Payment " + payment.getPaymentNumber() + " has already been posted");
        }
        if (payment.getInvoiceId() != null) {
            revalidatePending(tenantId, payment);
        }
        if (Amounts.isPositive(payment.getAmount())) {
            accountService.requirePaymentAccount(tenantId, payment.getAccountId());
        }

        String paymentNumber = persistenceService.nextPaymentNumber(tenantId, payment.getDate());
        Payment posted = payment.posted(UUID.randomUUID(), paymentNumber);
        try (MDC.MDCCloseable ignored = LogContext.postingPayment(paymentNumber)) {
            TransactionRequest journal = journalBuilder.build(posted,
                chartAccount -> accountService.getOrCreate(tenantId, chartAccount));
            PostedTransaction transaction = ledgerService.postTransaction(tenantId, journal);
            persistenceService.save(tenantId, posted, idempotencyKey, transaction.getId());

            log.info("Posted payment {} ({}): cash={}, advance={}, journal={}",
                paymentNumber, posted.getType(), posted.getAmount(), posted.getAdvanceAmountUsed(),
                transaction.getTransactionNumber());
            return posted;
        }
    }

    private void revalidatePending(UUID tenantId, Payment payment) {
        Invoice invoice = invoiceDirectory.lockInvoice(tenantId, payment.getInvoiceId())
            .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + payment.getInvoiceId()));
        BigDecimal pending = pendingAmountCalculator.calculatePendingAmount(invoice);
        BigDecimal settled = Amounts.normalize(payment.getSettledAmount());
        if (settled.compareTo(pending) > 0) {
            throw new StalePendingAmountException(invoice.getId(), invoice.getInvoiceNumber(), settled, pending);
        }
    }
}
