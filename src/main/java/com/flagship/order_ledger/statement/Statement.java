package com.flagship.order_ledger.statement;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.invoice.BalanceSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Statement of one customer or supplier, lines most recent first.
 */
@Value
@Builder
public class Statement {

    @JsonProperty("entity_role")
    EntityRole entityRole;

    @JsonProperty("lines")
    List<StatementLine> lines;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @JsonProperty("closing_direction")
    BalanceDirection closingDirection;

    @JsonProperty("closing_label")
    String closingLabel;

    @JsonProperty("balance")
    BalanceSnapshot balance;
}
