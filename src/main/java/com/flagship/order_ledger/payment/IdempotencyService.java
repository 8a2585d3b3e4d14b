package com.flagship.order_ledger.payment;

import com.flagship.order_ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for idempotency key management.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the payments table (slower, but always available)
 * 3. Cache database hits in Redis for later lookups
 *
 * The payments table stays the source of truth: a key is only "used" once a
 * payment row carrying it has been committed.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              LedgerProperties properties) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getIdempotencyTtl();
    }

    /**
     * Key under which one allocation share is stored: the client's key plus the invoice it settles.
     */
    public static String shareKey(String idempotencyKey, UUID invoiceId) {
        return idempotencyKey + ":" + invoiceId;
    }

    /**
     * @return id of the payment already stored under the key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String paymentId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (paymentId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(paymentId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> paymentId = paymentRepository.findByIdempotencyKey(idempotencyKey)
            .map(PaymentEntity::getId);
        if (paymentId.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, paymentId.get());
        }
        return paymentId;
    }

    /**
     * Caches a committed key in Redis. The database row already holds the key.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID paymentId) {
        requireKey(idempotencyKey);
        if (paymentId == null) {
            throw new IllegalArgumentException("Payment ID cannot be null");
        }
        cache(idempotencyKey, paymentId);
    }

    private void cache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
