package com.flagship.order_ledger.ledger;

import com.flagship.order_ledger.payment.Payment;
import com.flagship.order_ledger.payment.PaymentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PaymentJournalBuilderTest {

    private static final UUID BANK_ID = UUID.randomUUID();
    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private final PaymentJournalBuilder builder = new PaymentJournalBuilder();
    private final Map<ChartOfAccounts, UUID> chart = new EnumMap<>(ChartOfAccounts.class);
    private final Function<ChartOfAccounts, UUID> accounts =
        chartAccount -> chart.computeIfAbsent(chartAccount, key -> UUID.randomUUID());

    private static Payment.PaymentBuilder payment(PaymentType type, String cash, String advance) {
        return Payment.builder()
            .id(UUID.randomUUID())
            .paymentNumber("PAY-2024-0001")
            .date(LocalDate.of(2024, 3, 15))
            .type(type)
            .amount(new BigDecimal(cash))
            .accountId(BANK_ID)
            .advanceAmountUsed(new BigDecimal(advance));
    }

    private static TransactionRequest.Line line(List<TransactionRequest.Line> lines, UUID accountId) {
        return lines.stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No line for account " + accountId));
    }

    @Test
    @DisplayName("Customer payment debits bank and customer advance, credits receivables")
    void testCustomerPayment() {
        TransactionRequest journal = builder.build(payment(PaymentType.CUSTOMER_PAYMENT, "160.00", "40.00").build(), accounts);

        assertTrue(journal.isBalanced(TOLERANCE));
        assertEquals(3, journal.getLines().size());
        assertEquals(new BigDecimal("160.00"), line(journal.getLines(), BANK_ID).getDebitAmount());
        assertEquals(new BigDecimal("40.00"),
            line(journal.getLines(), chart.get(ChartOfAccounts.CUSTOMER_ADVANCE)).getDebitAmount());
        assertEquals(new BigDecimal("200.00"),
            line(journal.getLines(), chart.get(ChartOfAccounts.ACCOUNTS_RECEIVABLE)).getCreditAmount());
        assertEquals("Payment: PAY-2024-0001 - CUSTOMER_PAYMENT (Paid: 160.00, Advance Used: 40.00)",
            journal.getDescription());
        assertEquals(LocalDate.of(2024, 3, 15), journal.getDate());
    }

    @Test
    @DisplayName("Supplier payment debits payables, credits bank and supplier advance")
    void testSupplierPayment() {
        TransactionRequest journal = builder.build(payment(PaymentType.SUPPLIER_PAYMENT, "240.00", "60.00").build(), accounts);

        assertTrue(journal.isBalanced(TOLERANCE));
        assertEquals(new BigDecimal("300.00"),
            line(journal.getLines(), chart.get(ChartOfAccounts.ACCOUNTS_PAYABLE)).getDebitAmount());
        assertEquals(new BigDecimal("240.00"), line(journal.getLines(), BANK_ID).getCreditAmount());
        assertEquals(new BigDecimal("60.00"),
            line(journal.getLines(), chart.get(ChartOfAccounts.ADVANCE_TO_SUPPLIERS)).getCreditAmount());
    }

    @Test
    @DisplayName("A payment settled only from advance has no bank line")
    void testAdvanceOnlyPayment() {
        Payment advanceOnly = payment(PaymentType.CUSTOMER_PAYMENT, "0.00", "75.00").accountId(null).build();

        TransactionRequest journal = builder.build(advanceOnly, accounts);

        assertEquals(2, journal.getLines().size());
        assertTrue(journal.isBalanced(TOLERANCE));
    }

    @Test
    @DisplayName("Refund debits sales returns and credits the bank")
    void testRefund() {
        TransactionRequest journal = builder.build(payment(PaymentType.REFUND, "35.00", "0.00").build(), accounts);

        assertEquals(new BigDecimal("35.00"),
            line(journal.getLines(), chart.get(ChartOfAccounts.SALES_RETURNS)).getDebitAmount());
        assertEquals(new BigDecimal("35.00"), line(journal.getLines(), BANK_ID).getCreditAmount());
    }

    @Test
    @DisplayName("Payments that move nothing, lack an account or refund from advance are rejected")
    void testInvalidPayments() {
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(payment(PaymentType.CUSTOMER_PAYMENT, "0.00", "0.00").build(), accounts));
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(payment(PaymentType.CUSTOMER_PAYMENT, "10.00", "0.00").accountId(null).build(), accounts));
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(payment(PaymentType.REFUND, "10.00", "5.00").build(), accounts));
    }
}
