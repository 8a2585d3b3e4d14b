package com.flagship.order_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.common.EntityRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A payment to be split across one or more invoices of a single customer or supplier.
 *
 * advanceUsed is drawn from the counterparty's advance balance and shared across
 * the selected invoices; availableAdvance, when known, caps it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AllocationRequest {

    @NotNull(message = "Entity role is required")
    @JsonProperty("entity_role")
    EntityRole entityRole;

    @NotNull(message = "Entity ID is required")
    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @Valid
    @NotEmpty(message = "At least one invoice must be selected")
    @JsonProperty("selections")
    List<@NotNull(message = "Selection cannot be empty") InvoiceSelection> selections;

    @JsonProperty("advance_used")
    BigDecimal advanceUsed;

    @JsonProperty("payment_account_id")
    UUID paymentAccountId;

    @JsonProperty("available_advance")
    BigDecimal availableAdvance;
}
