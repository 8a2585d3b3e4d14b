package com.flagship.order_ledger.fee;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A tenant's shipping tariff. Null defaults fall back to the configured system defaults.
 */
@Value
@Builder
public class ShippingConfig {
    /** City name to base charge; the key "default" is the fallback for unlisted cities. */
    @Builder.Default
    Map<String, BigDecimal> cityCharges = Map.of();
    BigDecimal defaultCityCharge;
    @Builder.Default
    FeeRuleSet quantityRules = FeeRuleSet.empty();
    BigDecimal defaultQuantityCharge;
}
