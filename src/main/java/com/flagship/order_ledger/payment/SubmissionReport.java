package com.flagship.order_ledger.payment;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.payment.dto.PaymentResponse;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of submitting the payments of one allocation, item by item and in
 * submission order. Tells the caller exactly which invoices were paid.
 */
@Value
public class SubmissionReport {

    @JsonProperty("items")
    List<ItemResult> items;

    /**
     * True when every payment is now stored, whether by this call or an earlier one.
     */
    @JsonProperty("complete")
    public boolean isComplete() {
        return items.stream().allMatch(item ->
            item.getStatus() == ItemStatus.SUCCEEDED || item.getStatus() == ItemStatus.ALREADY_POSTED);
    }

    public long count(ItemStatus status) {
        return items.stream().filter(item -> item.getStatus() == status).count();
    }

    public enum ItemStatus {
        SUCCEEDED,
        /** Stored by an earlier submission with the same idempotency key. */
        ALREADY_POSTED,
        FAILED,
        /** Skipped because an earlier item failed. */
        NOT_ATTEMPTED
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ItemResult {

        @JsonProperty("invoice_id")
        UUID invoiceId;

        @JsonProperty("status")
        ItemStatus status;

        @JsonProperty("payment")
        PaymentResponse payment;

        @JsonProperty("error")
        String error;
    }
}
