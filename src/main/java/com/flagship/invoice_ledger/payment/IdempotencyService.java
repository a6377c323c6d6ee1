package com.flagship.invoice_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-key lookups for payment requests.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the payments table, which is the source of truth
 * 3. Cache database hits back into Redis
 *
 * Keys are scoped per owner. A Redis failure is logged and never fails the request.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:payment:";

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${idempotency.redis.ttl-hours:168}") long ttlHours) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofHours(ttlHours);
    }

    /**
     * Finds the payment previously created with this key, if any.
     * A Redis entry whose payment no longer exists is ignored.
     */
    public Optional<PaymentEntity> findPrevious(UUID ownerId, String idempotencyKey) {
        Optional<UUID> cachedId = lookupCache(ownerId, idempotencyKey);
        if (cachedId.isPresent()) {
            Optional<PaymentEntity> cached = paymentRepository.findByIdAndOwnerId(cachedId.get(), ownerId);
            if (cached.isPresent()) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
        }

        Optional<PaymentEntity> stored = paymentRepository.findByOwnerIdAndIdempotencyKey(ownerId, idempotencyKey);
        stored.ifPresent(payment -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            remember(ownerId, idempotencyKey, payment.getId());
        });
        return stored;
    }

    /**
     * Caches a key after the payment carrying it has committed.
     */
    public void remember(UUID ownerId, String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(ownerId, idempotencyKey), paymentId.toString(), ttl);
            log.debug("Stored idempotency key in Redis: {} -> {}", idempotencyKey, paymentId);
        } catch (RuntimeException e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private Optional<UUID> lookupCache(UUID ownerId, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String paymentId = redisTemplate.get().opsForValue().get(redisKey(ownerId, idempotencyKey));
            return Optional.ofNullable(paymentId).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private static String redisKey(UUID ownerId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + ownerId + ":" + idempotencyKey;
    }
}
