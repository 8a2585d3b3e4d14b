package com.flagship.order_ledger.invoice;

import com.flagship.order_ledger.common.EntityRole;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to invoices and balances owned by the persistence layer.
 */
public interface InvoiceDirectory {

    List<Invoice> fetchInvoicesForEntity(UUID tenantId, EntityRole role, UUID entityId);

    BalanceSnapshot fetchBalanceSnapshot(UUID tenantId, EntityRole role, UUID entityId);

    /**
     * Loads a single invoice and locks it until the surrounding database
     * transaction ends, so a payment can be re-validated against a pending
     * amount nobody else is changing.
     */
    Optional<Invoice> lockInvoice(UUID tenantId, UUID invoiceId);
}
