package com.flagship.order_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.fee.FeeDomain;
import com.flagship.order_ledger.fee.FeeMode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class FeeEvaluationResponse {

    @JsonProperty("value")
    BigDecimal value;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("mode")
    FeeMode mode;

    @JsonProperty("domain")
    FeeDomain domain;

    @JsonProperty("warnings")
    List<String> warnings;
}
