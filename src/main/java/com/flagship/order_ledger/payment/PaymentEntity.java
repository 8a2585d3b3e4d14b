package com.flagship.order_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA Entity for Payment persistence.
 *
 * Payments are written once and never updated, so every column is
 * updatable = false and there are no setters. fromDomain() is the only way to
 * create an instance.
 *
 * The idempotency key is a persistence concern and is passed separately from
 * the domain object.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "payment_number", nullable = false, updatable = false, length = 30)
    private String paymentNumber;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 20)
    private PaymentType paymentType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "customer_id", updatable = false)
    private UUID customerId;

    @Column(name = "supplier_id", updatable = false)
    private UUID supplierId;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Column(name = "purchase_invoice_id", updatable = false)
    private UUID purchaseInvoiceId;

    @Column(name = "use_advance_balance", nullable = false, updatable = false)
    private boolean useAdvanceBalance;

    @Column(name = "advance_amount_used", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal advanceAmountUsed;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    /**
     * Journal transaction written together with this payment.
     */
    @Column(name = "ledger_transaction_id", updatable = false)
    private UUID ledgerTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    /**
     * @param payment a posted payment (it must carry its id and payment number)
     */
    static PaymentEntity fromDomain(UUID tenantId, Payment payment, String idempotencyKey, UUID ledgerTransactionId) {
        if (!payment.isPosted()) {
            throw new IllegalArgumentException("Only a posted payment can be stored");
        }
        return new PaymentEntity(
            payment.getId(),
            tenantId,
            payment.getPaymentNumber(),
            payment.getDate(),
            payment.getType(),
            payment.getAmount(),
            payment.getAccountId(),
            payment.getCustomerId(),
            payment.getSupplierId(),
            payment.getOrderId(),
            payment.getPurchaseInvoiceId(),
            payment.isUseAdvanceBalance(),
            payment.getAdvanceAmountUsed() != null ? payment.getAdvanceAmountUsed() : BigDecimal.ZERO,
            idempotencyKey,
            ledgerTransactionId,
            null // createdAt - set by @PrePersist
        );
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .paymentNumber(paymentNumber)
            .date(paymentDate)
            .type(paymentType)
            .amount(amount)
            .accountId(accountId)
            .customerId(customerId)
            .supplierId(supplierId)
            .orderId(orderId)
            .purchaseInvoiceId(purchaseInvoiceId)
            .useAdvanceBalance(useAdvanceBalance)
            .advanceAmountUsed(advanceAmountUsed)
            .build();
    }
}
