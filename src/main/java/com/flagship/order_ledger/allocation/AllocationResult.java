package com.flagship.order_ledger.allocation;

import com.flagship.order_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of splitting a payment: one unposted Payment per selected invoice.
 *
 * totalCash always equals the sum of the payments' cash amounts and
 * advanceApplied never exceeds the advance that was offered.
 */
@Value
public class AllocationResult {
    List<Payment> payments;
    BigDecimal totalRequested;
    BigDecimal totalCash;
    BigDecimal advanceApplied;
    BigDecimal advanceUnused;
}
