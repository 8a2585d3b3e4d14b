package com.flagship.order_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class PendingAmountRequest {

    @Valid
    @NotNull(message = "Invoices are required")
    @JsonProperty("invoices")
    List<InvoiceInput> invoices;
}
