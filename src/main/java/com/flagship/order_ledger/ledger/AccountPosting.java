package com.flagship.order_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One transaction line against a single account, joined with its transaction header.
 */
@Value
@Builder
@Jacksonized
public class AccountPosting {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("transaction_number")
    String transactionNumber;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("debit_amount")
    BigDecimal debitAmount;

    @JsonProperty("credit_amount")
    BigDecimal creditAmount;
}
