package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tier of a fee table: values in [min, max] cost fee. A null max has no upper bound.
 */
@Value
public class FeeRule {

    @JsonProperty("min")
    BigDecimal min;

    @JsonProperty("max")
    BigDecimal max;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonCreator
    public FeeRule(@JsonProperty("min") BigDecimal min,
                   @JsonProperty("max") BigDecimal max,
                   @JsonProperty("fee") @JsonAlias("charge") BigDecimal fee) {
        this.min = min;
        this.max = max;
        this.fee = fee;
    }

    public boolean matches(BigDecimal value) {
        return value.compareTo(min) >= 0 && (max == null || value.compareTo(max) <= 0);
    }

    /**
     * @param key prefix for the violation keys, e.g. {@code rules[2]}
     * @return violations keyed by {@code key.field}; empty when the rule is valid
     */
    Map<String, String> validate(String key) {
        Map<String, String> violations = new LinkedHashMap<>();
        if (min == null) {
            violations.put(key + ".min", "Minimum is required");
        } else if (min.compareTo(BigDecimal.ONE) < 0) {
            violations.put(key + ".min", "Minimum must be at least 1");
        }
        if (max != null && min != null && max.compareTo(min) < 0) {
            violations.put(key + ".max", "Maximum must be empty or at least the minimum " + min);
        }
        if (fee == null) {
            violations.put(key + ".fee", "Fee is required");
        } else if (fee.signum() < 0) {
            violations.put(key + ".fee", "Fee cannot be negative");
        }
        return violations;
    }
}
