package com.flagship.order_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A posting together with the account balance right after it.
 * Derived for display and never stored.
 */
@Value
@Builder
public class AccountLedgerEntry {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("transaction_number")
    String transactionNumber;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("balance")
    BigDecimal balance;
}
