package com.flagship.order_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class InvoiceBalance {

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("pending")
    BigDecimal pending;

    @JsonProperty("payable")
    boolean payable;
}
