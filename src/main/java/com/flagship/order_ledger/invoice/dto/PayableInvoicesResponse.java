package com.flagship.order_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.invoice.BalanceSnapshot;
import lombok.Value;

import java.util.List;

/**
 * Invoices a payment can still be allocated to, with the counterparty's balance.
 */
@Value
public class PayableInvoicesResponse {

    @JsonProperty("invoices")
    List<InvoiceBalance> invoices;

    @JsonProperty("balance")
    BalanceSnapshot balance;
}
