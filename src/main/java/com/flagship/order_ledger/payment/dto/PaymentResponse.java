package com.flagship.order_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.payment.Payment;
import com.flagship.order_ledger.payment.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * REST view of a payment. id and payment_number are absent until it is posted.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_number")
    String paymentNumber;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("type")
    PaymentType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("supplier_id")
    UUID supplierId;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("purchase_invoice_id")
    UUID purchaseInvoiceId;

    @JsonProperty("use_advance_balance")
    boolean useAdvanceBalance;

    @JsonProperty("advance_amount_used")
    BigDecimal advanceAmountUsed;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .paymentNumber(payment.getPaymentNumber())
            .date(payment.getDate())
            .type(payment.getType())
            .amount(payment.getAmount())
            .accountId(payment.getAccountId())
            .customerId(payment.getCustomerId())
            .supplierId(payment.getSupplierId())
            .orderId(payment.getOrderId())
            .purchaseInvoiceId(payment.getPurchaseInvoiceId())
            .useAdvanceBalance(payment.isUseAdvanceBalance())
            .advanceAmountUsed(payment.getAdvanceAmountUsed())
            .build();
    }
}
