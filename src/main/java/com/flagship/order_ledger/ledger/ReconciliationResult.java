package com.flagship.order_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored (cached) account balance compared with the balance rebuilt from its lines.
 */
@Value
public class ReconciliationResult {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("stored_balance")
    BigDecimal storedBalance;

    @JsonProperty("computed_balance")
    BigDecimal computedBalance;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("reconciled")
    boolean reconciled;
}
