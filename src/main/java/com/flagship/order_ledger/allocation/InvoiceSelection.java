package com.flagship.order_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One invoice chosen for payment and the amount to settle on it, advance included.
 */
@Value
public class InvoiceSelection {

    @NotNull(message = "Invoice ID is required")
    @JsonProperty("invoice_id")
    UUID invoiceId;

    @NotNull(message = "Requested amount is required")
    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;
}
