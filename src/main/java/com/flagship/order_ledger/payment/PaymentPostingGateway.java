package com.flagship.order_ledger.payment;

import java.util.UUID;

/**
 * Writes one payment together with its journal transaction.
 */
public interface PaymentPostingGateway {

    /**
     * Posts a single payment atomically: either the payment row and its balanced
     * transaction are both written, or nothing is.
     *
     * @param tenantId       owner of the payment
     * @param payment        an unposted payment, as produced by the allocator
     * @param idempotencyKey key stored with the payment row
     * @return the payment with its id and payment number
     * @throws StalePendingAmountException if the invoice no longer has enough pending
     * @throws IllegalArgumentException    if the payment references unknown records
     */
    Payment postPayment(UUID tenantId, Payment payment, String idempotencyKey);
}
