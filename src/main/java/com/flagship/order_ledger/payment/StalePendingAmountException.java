package com.flagship.order_ledger.payment;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The invoice's pending amount shrank between allocation and posting, so the
 * payment would now overpay it.
 */
@Getter
public class StalePendingAmountException extends IllegalStateException {

    private final UUID invoiceId;
    private final BigDecimal settledAmount;
    private final BigDecimal currentPending;

    public StalePendingAmountException(UUID invoiceId, String invoiceNumber,
                                       BigDecimal settledAmount, BigDecimal currentPending) {
        super(String.format("Payment of %s exceeds current pending amount %s on invoice %s",
            settledAmount, currentPending, invoiceNumber));
        this.invoiceId = invoiceId;
        this.settledAmount = settledAmount;
        this.currentPending = currentPending;
    }
}
