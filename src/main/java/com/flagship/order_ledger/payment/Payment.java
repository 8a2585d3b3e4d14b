package com.flagship.order_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Payment domain object.
 *
 * A payment is produced once per allocation share and never changes after it
 * has been posted. Before posting it has no id and no payment number.
 *
 * amount is the cash/bank portion; advanceAmountUsed is the part settled from
 * the counterparty's advance balance. Together they are what the payment
 * settles on its invoice.
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    String paymentNumber;
    LocalDate date;
    PaymentType type;
    BigDecimal amount;
    UUID accountId;
    UUID customerId;
    UUID supplierId;
    UUID orderId;
    UUID purchaseInvoiceId;
    boolean useAdvanceBalance;
    BigDecimal advanceAmountUsed;

    /**
     * The order or purchase invoice this payment settles, if any.
     */
    public UUID getInvoiceId() {
        return orderId != null ? orderId : purchaseInvoiceId;
    }

    public UUID getCounterpartyId() {
        return customerId != null ? customerId : supplierId;
    }

    public BigDecimal getSettledAmount() {
        BigDecimal advance = advanceAmountUsed == null ? BigDecimal.ZERO : advanceAmountUsed;
        return amount.add(advance);
    }

    public boolean isPosted() {
        return id != null;
    }

    /**
     * Returns the stored form of this payment.
     *
     * @throws IllegalStateException if the payment has already been posted
     */
    public Payment posted(UUID id, String paymentNumber) {
        if (isPosted()) {
            throw new IllegalStateException(
                String.format("Payment %s has already been posted as %s", this.id, this.paymentNumber));
        }
        return toBuilder().id(id).paymentNumber(paymentNumber).build();
    }
}
