package com.flagship.order_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.fee.FeeRuleSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Value
public class ShippingRequest {

    @JsonProperty("city")
    String city;

    @JsonProperty("city_charges")
    Map<String, BigDecimal> cityCharges;

    @JsonProperty("default_city_charge")
    BigDecimal defaultCityCharge;

    @JsonProperty("quantity_rules")
    FeeRuleSource quantityRules;

    @JsonProperty("default_quantity_charge")
    BigDecimal defaultQuantityCharge;

    @Valid
    @JsonProperty("products")
    List<ProductLine> products;

    @Value
    public static class ProductLine {

        @JsonProperty("product_id")
        String productId;

        @NotNull(message = "Quantity is required")
        @Min(value = 1, message = "Quantity must be at least 1")
        @JsonProperty("quantity")
        Integer quantity;

        /** Defaults to true when omitted. */
        @JsonProperty("use_default_shipping")
        Boolean useDefaultShipping;

        @JsonProperty("shipping_quantity_rules")
        FeeRuleSource shippingQuantityRules;

        @JsonProperty("shipping_default_quantity_charge")
        BigDecimal shippingDefaultQuantityCharge;
    }
}
