package com.flagship.order_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.ledger.AccountLedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ReconstructLedgerResponse {

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @JsonProperty("entries")
    List<AccountLedgerEntry> entries;
}
