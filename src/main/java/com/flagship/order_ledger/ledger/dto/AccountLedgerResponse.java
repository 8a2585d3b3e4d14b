package com.flagship.order_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.ledger.Account;
import com.flagship.order_ledger.ledger.AccountLedgerEntry;
import com.flagship.order_ledger.ledger.ReconciliationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Ledger of a stored account, most recent entry first.
 */
@Value
@Builder
public class AccountLedgerResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @JsonProperty("entries")
    List<AccountLedgerEntry> entries;

    @JsonProperty("reconciliation")
    ReconciliationResult reconciliation;
}
