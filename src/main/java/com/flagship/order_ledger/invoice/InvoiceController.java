package com.flagship.order_ledger.invoice;

import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.invoice.dto.InvoiceBalance;
import com.flagship.order_ledger.invoice.dto.InvoiceInput;
import com.flagship.order_ledger.invoice.dto.PayableInvoicesResponse;
import com.flagship.order_ledger.invoice.dto.PendingAmountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final PendingAmountCalculator calculator;
    private final InvoiceDirectory invoiceDirectory;

    /**
     * Pending amounts of client-supplied invoices. Nothing is read from storage.
     */
    @PostMapping("/pending")
    public ResponseEntity<List<InvoiceBalance>> calculatePending(@Valid @RequestBody PendingAmountRequest request) {
        List<InvoiceBalance> balances = request.getInvoices().stream()
            .map(InvoiceInput::toInvoice)
            .map(this::toBalance)
            .collect(Collectors.toList());
        return ResponseEntity.ok(balances);
    }

    @GetMapping("/payable")
    public ResponseEntity<PayableInvoicesResponse> payableInvoices(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestParam("role") EntityRole role,
            @RequestParam("entity_id") UUID entityId) {
        List<InvoiceBalance> payable = calculator.payableInvoices(
                invoiceDirectory.fetchInvoicesForEntity(tenantId, role, entityId)).stream()
            .map(this::toBalance)
            .collect(Collectors.toList());
        return ResponseEntity.ok(new PayableInvoicesResponse(
            payable, invoiceDirectory.fetchBalanceSnapshot(tenantId, role, entityId)));
    }

    private InvoiceBalance toBalance(Invoice invoice) {
        var pending = calculator.calculatePendingAmount(invoice);
        return new InvoiceBalance(
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getInvoiceDate(),
            invoice.getTotalAmount(),
            calculator.totalPaid(invoice),
            pending,
            pending.signum() > 0
        );
    }
}
