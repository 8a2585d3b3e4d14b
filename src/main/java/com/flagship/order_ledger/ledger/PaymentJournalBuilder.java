package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.common.Amounts;
import com.flagship.order_ledger.payment.Payment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Builds the balanced journal transaction for a posted payment.
 *
 * Customer payment:  Dr cash/bank (cash), Dr Customer Advance (advance), Cr Accounts Receivable (both)
 * Supplier payment:  Dr Accounts Payable (both), Cr cash/bank (cash), Cr Advance to Suppliers (advance)
 * Refund:            Dr Sales Returns, Cr cash/bank
 */
@Component
public class PaymentJournalBuilder {

    /**
     * @param payment  a payment that already carries its payment number
     * @param accounts resolves a standard chart entry to the tenant's account id
     */
    public TransactionRequest build(Payment payment, Function<ChartOfAccounts, UUID> accounts) {
        BigDecimal cash = Amounts.normalize(payment.getAmount());
        BigDecimal advance = Amounts.normalize(payment.getAdvanceAmountUsed());
        BigDecimal settled = cash.add(advance);
        if (settled.signum() <= 0) {
            throw new IllegalArgumentException("Payment " + payment.getPaymentNumber() + " moves no money");
        }
        if (cash.signum() > 0 && payment.getAccountId() == null) {
            throw new IllegalArgumentException(
                "Payment " + payment.getPaymentNumber() + " has a cash amount but no payment account");
        }

        List<TransactionRequest.Line> lines = new ArrayList<>();
        switch (payment.getType()) {
            case CUSTOMER_PAYMENT:
                if (cash.signum() > 0) {
                    lines.add(TransactionRequest.Line.debit(payment.getAccountId(), cash));
                }
                if (advance.signum() > 0) {
                    lines.add(TransactionRequest.Line.debit(accounts.apply(ChartOfAccounts.CUSTOMER_ADVANCE), advance));
                }
                lines.add(TransactionRequest.Line.credit(accounts.apply(ChartOfAccounts.ACCOUNTS_RECEIVABLE), settled));
                break;
            case SUPPLIER_PAYMENT:
                lines.add(TransactionRequest.Line.debit(accounts.apply(ChartOfAccounts.ACCOUNTS_PAYABLE), settled));
                if (cash.signum() > 0) {
                    lines.add(TransactionRequest.Line.credit(payment.getAccountId(), cash));
                }
                if (advance.signum() > 0) {
                    lines.add(TransactionRequest.Line.credit(accounts.apply(ChartOfAccounts.ADVANCE_TO_SUPPLIERS), advance));
                }
                break;
            case REFUND:
                if (advance.signum() > 0) {
                    throw new IllegalArgumentException("A refund cannot draw on an advance balance");
                }
                lines.add(TransactionRequest.Line.debit(accounts.apply(ChartOfAccounts.SALES_RETURNS), cash));
                lines.add(TransactionRequest.Line.credit(payment.getAccountId(), cash));
                break;
            default:
                throw new IllegalArgumentException("Unsupported payment type: " + payment.getType());
        }

        return new TransactionRequest(payment.getDate(), describe(payment, cash, advance), lines);
    }

    static String describe(Payment payment, BigDecimal cash, BigDecimal advance) {
        return String.format("Payment: %s - %s (Paid: %s, Advance Used: %s)",
            payment.getPaymentNumber(), payment.getType(), cash, advance);
    }
}
