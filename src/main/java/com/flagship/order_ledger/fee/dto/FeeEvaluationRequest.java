package com.flagship.order_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.fee.FeeDomain;
import com.flagship.order_ledger.fee.FeeMode;
import com.flagship.order_ledger.fee.FeeRuleSource;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class FeeEvaluationRequest {

    @NotNull(message = "Mode is required")
    @JsonProperty("mode")
    FeeMode mode;

    /** Defaults to COD when omitted. */
    @JsonProperty("domain")
    FeeDomain domain;

    @JsonProperty("rules")
    FeeRuleSource rules;

    @JsonProperty("default_fee")
    BigDecimal defaultFee;

    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonProperty("flat_amount")
    BigDecimal flatAmount;

    @NotNull(message = "Value is required")
    @DecimalMin(value = "0", message = "Value cannot be negative")
    @JsonProperty("value")
    BigDecimal value;
}
