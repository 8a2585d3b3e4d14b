package com.flagship.order_ledger.payment;

import com.flagship.order_ledger.common.DocumentNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Payment domain object and its PaymentEntity row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Saves a posted payment and flushes, so a duplicate idempotency key or
     * payment number fails here rather than at commit.
     */
    @Transactional
    public PaymentEntity save(UUID tenantId, Payment payment, String idempotencyKey, UUID ledgerTransactionId) {
        PaymentEntity entity = PaymentEntity.fromDomain(tenantId, payment, idempotencyKey, ledgerTransactionId);
        PaymentEntity saved = paymentRepository.saveAndFlush(entity);
        log.debug("Saved payment {} with idempotency key {}", saved.getPaymentNumber(), idempotencyKey);
        return saved;
    }

    /**
     * A payment of another tenant is reported as absent.
     */
    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID tenantId, UUID paymentId) {
        return paymentRepository.findByTenantIdAndId(tenantId, paymentId)
            .map(PaymentEntity::toDomain);
    }

    /**
     * PAY-&lt;year&gt;-&lt;4-digit sequence&gt;, counted per tenant and year of the payment date.
     */
    @Transactional
    public String nextPaymentNumber(UUID tenantId, LocalDate paymentDate) {
        return DocumentNumbers.next(jdbcTemplate, "payments", "payment_number",
            tenantId, DocumentNumbers.PAYMENT_PREFIX, paymentDate);
    }
}
