package com.flagship.order_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.ledger.Account;
import com.flagship.order_ledger.ledger.AccountPosting;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Lines of one account to rebuild a running balance from.
 */
@Value
public class ReconstructLedgerRequest {

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    Account.AccountType accountType;

    @Valid
    @NotNull(message = "Postings are required")
    @JsonProperty("postings")
    List<AccountPosting> postings;

    /** Defaults to true when omitted. */
    @JsonProperty("most_recent_first")
    Boolean mostRecentFirst;
}
