package com.flagship.order_ledger.statement;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An opening balance, order, purchase invoice, payment, return or refund to
 * place on a statement. amount is positive except for an opening balance,
 * whose sign says which way it points.
 */
@Value
@Builder
@Jacksonized
public class StatementSourceEntry {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotNull(message = "Entry type is required")
    @JsonProperty("type")
    LedgerEntryType type;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;
}
