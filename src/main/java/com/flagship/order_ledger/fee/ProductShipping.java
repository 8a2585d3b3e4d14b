package com.flagship.order_ledger.fee;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One product line of an order, with the product's own shipping overrides.
 * The overrides only apply when useDefaultShipping is false.
 */
@Value
@Builder
public class ProductShipping {
    String productId;
    int quantity;
    @Builder.Default
    boolean useDefaultShipping = true;
    @Builder.Default
    FeeRuleSet rules = FeeRuleSet.empty();
    BigDecimal defaultQuantityCharge;
}
