package com.flagship.order_ledger.statement;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class StatementLine {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("type")
    LedgerEntryType type;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    /** Running balance after this line, positive in the OWES direction. */
    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("direction")
    BalanceDirection direction;

    @JsonProperty("balance_label")
    String balanceLabel;
}
