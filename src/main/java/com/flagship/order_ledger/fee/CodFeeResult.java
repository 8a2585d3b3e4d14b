package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CodFeeResult {

    @JsonProperty("cod_amount")
    BigDecimal codAmount;

    @JsonProperty("cod_fee")
    BigDecimal codFee;

    @JsonProperty("calculation_type")
    FeeMode calculationType;
}
