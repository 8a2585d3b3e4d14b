package com.flagship.order_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.invoice.Invoice;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Invoice with its payment sources as sent by a client.
 */
@Value
public class InvoiceInput {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @NotNull(message = "Total amount is required")
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("linked_payments")
    List<BigDecimal> linkedPayments;

    @JsonProperty("entity_payments")
    List<BigDecimal> entityPayments;

    @JsonProperty("legacy_payment_amount")
    BigDecimal legacyPaymentAmount;

    public Invoice toInvoice() {
        return Invoice.builder()
            .id(id)
            .invoiceNumber(invoiceNumber)
            .invoiceDate(invoiceDate)
            .totalAmount(totalAmount)
            .linkedPayments(linkedPayments != null ? linkedPayments : List.of())
            .entityPayments(entityPayments != null ? entityPayments : List.of())
            .legacyPaymentAmount(legacyPaymentAmount)
            .build();
    }
}
