package com.flagship.order_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.fee.FeeRule;
import lombok.Value;

import java.util.List;

/**
 * A rule table that passed validation, sorted, with any overlap warnings.
 */
@Value
public class RuleValidationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("rules")
    List<FeeRule> rules;

    @JsonProperty("warnings")
    List<String> warnings;
}
