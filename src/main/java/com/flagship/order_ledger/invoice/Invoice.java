package com.flagship.order_ledger.invoice;

import com.flagship.order_ledger.common.EntityRole;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of an order (customer side) or purchase invoice (supplier side)
 * together with every payment source that can settle it.
 *
 * Payment sources, in order of precedence:
 * - payments linked directly to this invoice
 * - payments linked only to the owning customer/supplier
 * - the legacy single paymentAmount recorded on old invoices
 */
@Value
@Builder(toBuilder = true)
public class Invoice {
    UUID id;
    String invoiceNumber;
    LocalDate invoiceDate;
    EntityRole entityRole;
    UUID entityId;
    BigDecimal totalAmount;

    @Singular
    List<BigDecimal> linkedPayments;

    @Singular
    List<BigDecimal> entityPayments;

    BigDecimal legacyPaymentAmount;
}
