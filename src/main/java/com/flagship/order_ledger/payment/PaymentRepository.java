package com.flagship.order_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Payment rows are only ever inserted; every read goes through the owning tenant
 * except the idempotency lookup, whose keys are unique across tenants.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<PaymentEntity> findByTenantIdAndId(UUID tenantId, UUID id);
}
