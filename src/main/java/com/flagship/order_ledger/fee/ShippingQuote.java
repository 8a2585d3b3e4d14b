package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ShippingQuote {

    @JsonProperty("city_charge")
    BigDecimal cityCharge;

    @JsonProperty("quantity_charge")
    BigDecimal quantityCharge;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("products")
    List<ProductCharge> products;

    @Value
    public static class ProductCharge {
        @JsonProperty("product_id")
        String productId;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("charge")
        BigDecimal charge;
    }
}
