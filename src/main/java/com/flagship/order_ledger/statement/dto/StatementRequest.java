package com.flagship.order_ledger.statement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.statement.StatementSourceEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class StatementRequest {

    @NotNull(message = "Entity role is required")
    @JsonProperty("entity_role")
    EntityRole entityRole;

    @Valid
    @NotNull(message = "Entries are required")
    @JsonProperty("entries")
    List<StatementSourceEntry> entries;
}
