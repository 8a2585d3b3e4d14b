package com.flagship.order_ledger.fee;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Everything needed to price one value. Which fields matter depends on mode:
 * percentage for PERCENTAGE, flatAmount for FIXED, rules and defaultFee for RANGE_BASED.
 */
@Value
@Builder
public class FeeRuleConfig {
    FeeMode mode;
    @Builder.Default
    FeeDomain domain = FeeDomain.COD;
    @Builder.Default
    FeeRuleSet rules = FeeRuleSet.empty();
    BigDecimal defaultFee;
    BigDecimal percentage;
    BigDecimal flatAmount;
}
