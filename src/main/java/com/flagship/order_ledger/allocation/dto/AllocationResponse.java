package com.flagship.order_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.allocation.AllocationResult;
import com.flagship.order_ledger.payment.dto.PaymentResponse;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class AllocationResponse {

    @JsonProperty("payments")
    List<PaymentResponse> payments;

    @JsonProperty("total_requested")
    BigDecimal totalRequested;

    @JsonProperty("total_cash")
    BigDecimal totalCash;

    @JsonProperty("advance_applied")
    BigDecimal advanceApplied;

    @JsonProperty("advance_unused")
    BigDecimal advanceUnused;

    public static AllocationResponse from(AllocationResult result) {
        return new AllocationResponse(
            result.getPayments().stream().map(PaymentResponse::from).collect(Collectors.toList()),
            result.getTotalRequested(),
            result.getTotalCash(),
            result.getAdvanceApplied(),
            result.getAdvanceUnused()
        );
    }
}
