package com.flagship.order_ledger.allocation;

import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.invoice.BalanceSnapshot;
import com.flagship.order_ledger.invoice.Invoice;
import com.flagship.order_ledger.invoice.InvoiceDirectory;
import com.flagship.order_ledger.invoice.PendingAmountCalculator;
import com.flagship.order_ledger.observability.LedgerMetrics;
import com.flagship.order_ledger.payment.Payment;
import com.flagship.order_ledger.payment.PaymentSubmissionService;
import com.flagship.order_ledger.payment.PaymentType;
import com.flagship.order_ledger.payment.SubmissionReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AllocationServiceTest {

    private static final UUID TENANT_ID = UUID.randomUUID();
    private static final UUID CUSTOMER_ID = UUID.randomUUID();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private InvoiceDirectory invoiceDirectory;

    @Mock
    private PaymentSubmissionService submissionService;

    private SimpleMeterRegistry registry;
    private AllocationService service;
    private Invoice order;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new AllocationService(
            invoiceDirectory,
            new PaymentAllocator(new PendingAmountCalculator()),
            submissionService,
            new LedgerMetrics(registry),
            CLOCK
        );
        order = Invoice.builder()
            .id(UUID.randomUUID())
            .invoiceNumber("ORD-1")
            .entityRole(EntityRole.CUSTOMER)
            .entityId(CUSTOMER_ID)
            .totalAmount(new BigDecimal("500.00"))
            .build();

        when(invoiceDirectory.fetchInvoicesForEntity(TENANT_ID, EntityRole.CUSTOMER, CUSTOMER_ID))
            .thenReturn(List.of(order));
    }

    private AllocationRequest.AllocationRequestBuilder request(String amount) {
        return AllocationRequest.builder()
            .entityRole(EntityRole.CUSTOMER)
            .entityId(CUSTOMER_ID)
            .selections(List.of(new InvoiceSelection(order.getId(), new BigDecimal(amount))))
            .paymentAccountId(UUID.randomUUID());
    }

    private void givenBalance(String netBalance) {
        when(invoiceDirectory.fetchBalanceSnapshot(TENANT_ID, EntityRole.CUSTOMER, CUSTOMER_ID))
            .thenReturn(BalanceSnapshot.fromNetBalance(new BigDecimal(netBalance)));
    }

    @Test
    @DisplayName("Payment date defaults to today")
    void testPaymentDateDefaultsToToday() {
        givenBalance("500.00");

        AllocationResult result = service.preview(TENANT_ID, request("200.00").build());

        assertEquals(LocalDate.of(2024, 3, 15), result.getPayments().get(0).getDate());
        assertEquals(1.0, registry.counter("allocation.requests", "result", "accepted").count());
    }

    @Test
    @DisplayName("Available advance comes from the stored balance, not from the request")
    void testAvailableAdvanceFromSnapshot() {
        // Given: the customer has 50 of advance but the client claims 1000
        givenBalance("-50.00");
        AllocationRequest request = request("200.00")
            .advanceUsed(new BigDecimal("100.00"))
            .availableAdvance(new BigDecimal("1000.00"))
            .build();

        // When / Then
        AllocationValidationException e = assertThrows(AllocationValidationException.class,
            () -> service.preview(TENANT_ID, request));
        assertEquals("Advance 100.00 exceeds available advance 50.00", e.getViolations().get("advance_used"));
        assertEquals(1.0, registry.counter("allocation.requests", "result", "rejected").count());
    }

    @Test
    @DisplayName("Submission posts the allocated payments under the client's key")
    @SuppressWarnings("unchecked")
    void testSubmitDelegatesPayments() {
        givenBalance("-80.00");
        SubmissionReport report = new SubmissionReport(List.of());
        when(submissionService.submit(eq(TENANT_ID), any(List.class), eq("key-1"))).thenReturn(report);

        AllocationService.Submission submission = service.submit(TENANT_ID,
            request("300.00").advanceUsed(new BigDecimal("80.00")).build(), "key-1");

        ArgumentCaptor<List<Payment>> payments = ArgumentCaptor.forClass(List.class);
        verify(submissionService).submit(eq(TENANT_ID), payments.capture(), eq("key-1"));
        assertEquals(1, payments.getValue().size());
        assertEquals(new BigDecimal("220.00"), payments.getValue().get(0).getAmount());
        assertEquals(new BigDecimal("80.00"), payments.getValue().get(0).getAdvanceAmountUsed());
        assertSame(report, submission.getReport());
        assertEquals(new BigDecimal("220.00"), submission.getAllocation().getTotalCash());
    }

    @Test
    @DisplayName("A rejected allocation posts nothing")
    void testRejectedSubmissionPostsNothing() {
        givenBalance("500.00");

        assertThrows(AllocationValidationException.class,
            () -> service.submit(TENANT_ID, request("600.00").build(), "key-2"));

        verify(submissionService, never()).submit(any(), any(), any());
    }

    @Test
    @DisplayName("A retried batch keeps the share that already settled its invoice")
    @SuppressWarnings("unchecked")
    void testRetryKeepsPostedShare() {
        // Given: the first attempt posted 100 (20 of it advance) and settled ORD-0 in full,
        // so ORD-0 has nothing pending and is not among the payable invoices
        UUID settledId = UUID.randomUUID();
        Payment postedShare = Payment.builder()
            .id(UUID.randomUUID())
            .paymentNumber("PAY-2024-0001")
            .date(LocalDate.of(2024, 3, 15))
            .type(PaymentType.CUSTOMER_PAYMENT)
            .amount(new BigDecimal("80.00"))
            .accountId(UUID.randomUUID())
            .customerId(CUSTOMER_ID)
            .orderId(settledId)
            .useAdvanceBalance(true)
            .advanceAmountUsed(new BigDecimal("20.00"))
            .build();
        when(submissionService.findPostedShares(TENANT_ID, List.of(settledId, order.getId()), "key-3"))
            .thenReturn(Map.of(settledId, postedShare));
        givenBalance("-100.00");
        when(submissionService.submit(eq(TENANT_ID), any(List.class), eq("key-3")))
            .thenReturn(new SubmissionReport(List.of()));

        AllocationRequest retry = AllocationRequest.builder()
            .entityRole(EntityRole.CUSTOMER)
            .entityId(CUSTOMER_ID)
            .selections(List.of(
                new InvoiceSelection(settledId, new BigDecimal("100.00")),
                new InvoiceSelection(order.getId(), new BigDecimal("300.00"))))
            .advanceUsed(new BigDecimal("50.00"))
            .paymentAccountId(UUID.randomUUID())
            .build();

        // When
        AllocationService.Submission submission = service.submit(TENANT_ID, retry, "key-3");

        // Then: the stored share is handed back unchanged and only the rest is allocated,
        // drawing the 30 of advance the first attempt did not use
        ArgumentCaptor<List<Payment>> payments = ArgumentCaptor.forClass(List.class);
        verify(submissionService).submit(eq(TENANT_ID), payments.capture(), eq("key-3"));
        assertEquals(2, payments.getValue().size());
        assertSame(postedShare, payments.getValue().get(0));
        assertEquals(new BigDecimal("270.00"), payments.getValue().get(1).getAmount());
        assertEquals(new BigDecimal("30.00"), payments.getValue().get(1).getAdvanceAmountUsed());
        assertEquals(new BigDecimal("400.00"), submission.getAllocation().getTotalRequested());
        assertEquals(new BigDecimal("350.00"), submission.getAllocation().getTotalCash());
        assertEquals(new BigDecimal("50.00"), submission.getAllocation().getAdvanceApplied());
    }
}
