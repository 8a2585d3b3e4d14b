package com.flagship.order_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.fee.FeeRuleSource;
import lombok.Value;

@Value
public class RuleValidationRequest {

    @JsonProperty("rules")
    FeeRuleSource rules;
}
