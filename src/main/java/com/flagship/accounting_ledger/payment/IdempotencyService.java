package com.flagship.accounting_ledger.payment;

import com.flagship.accounting_ledger.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a company's {@code Idempotency-Key} to the payment it already
 * produced.
 *
 * Keys are scoped per company: two tenants may send the same key. The
 * {@code (company_id, idempotency_key)} unique constraint on payments is
 * authoritative; Redis only caches the mapping and any Redis failure falls
 * through to the table.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String CACHE_PREFIX = "ledger:payment-key:";
    private static final Duration CACHE_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    public Optional<UUID> findPaymentId(UUID companyId, String idempotencyKey) {
        String cacheKey = cacheKey(companyId, idempotencyKey);
        Optional<UUID> cached = readCache(cacheKey);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<UUID> paymentId;
        try {
            paymentId = paymentRepository.findByCompanyIdAndIdempotencyKey(companyId, idempotencyKey)
                    .map(PaymentEntity::getId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to look up idempotency key " + idempotencyKey, e);
        }
        paymentId.ifPresent(id -> writeCache(cacheKey, id));
        return paymentId;
    }

    public void remember(UUID companyId, String idempotencyKey, UUID paymentId) {
        if (paymentId == null) {
            throw new IllegalArgumentException("Payment ID cannot be null");
        }
        writeCache(cacheKey(companyId, idempotencyKey), paymentId);
    }

    /**
     * Evicts the mapping of a reversed payment so the key can be used again.
     */
    public void forget(UUID companyId, String idempotencyKey) {
        if (idempotencyKey == null || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(cacheKey(companyId, idempotencyKey));
        } catch (DataAccessException e) {
            log.warn("Could not evict idempotency key {} of company {}: {}",
                    idempotencyKey, companyId, e.getMessage());
        }
    }

    static String cacheKey(UUID companyId, String idempotencyKey) {
        if (companyId == null) {
            throw new IllegalArgumentException("Company ID cannot be null");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        return CACHE_PREFIX + companyId + ":" + idempotencyKey;
    }

    private Optional<UUID> readCache(String cacheKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(cacheKey)).map(UUID::fromString);
        } catch (DataAccessException e) {
            log.warn("Idempotency cache unavailable, using the payments table: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String cacheKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(cacheKey, paymentId.toString(), CACHE_TTL);
        } catch (DataAccessException e) {
            log.debug("Idempotency key not cached: {}", e.getMessage());
        }
    }
}
