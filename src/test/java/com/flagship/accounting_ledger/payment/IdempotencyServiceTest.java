package com.flagship.accounting_ledger.payment;

import com.flagship.accounting_ledger.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private IdempotencyService service;
    private final UUID companyId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new IdempotencyService(paymentRepository, Optional.of(redisTemplate));
    }

    private PaymentEntity payment(String key) {
        return PaymentEntity.create(companyId, "PAY-000001", DocumentRef.invoice(UUID.randomUUID()),
                new BigDecimal("10.0000"), LocalDate.of(2026, 3, 20), PaymentMethod.CASH, null, null, key);
    }

    @Test
    @DisplayName("Cache keys are scoped by company")
    void cacheKeyIsPerCompany() {
        UUID other = UUID.randomUUID();

        assertNotEquals(IdempotencyService.cacheKey(companyId, "k"), IdempotencyService.cacheKey(other, "k"));
        assertTrue(IdempotencyService.cacheKey(companyId, "k").endsWith(companyId + ":k"));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyService.cacheKey(companyId, " "));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyService.cacheKey(null, "k"));
    }

    @Test
    @DisplayName("A cached key is answered from Redis without touching the table")
    void cacheHit() {
        UUID paymentId = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(IdempotencyService.cacheKey(companyId, "k"))).thenReturn(paymentId.toString());

        assertEquals(Optional.of(paymentId), service.findPaymentId(companyId, "k"));
        verify(paymentRepository, never()).findByCompanyIdAndIdempotencyKey(any(), anyString());
    }

    @Test
    @DisplayName("When Redis is down the payments table answers and nothing is cached")
    void redisDownFallsBackToTable() {
        PaymentEntity stored = payment("k");
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
        when(paymentRepository.findByCompanyIdAndIdempotencyKey(companyId, "k")).thenReturn(Optional.of(stored));

        assertEquals(Optional.of(stored.getId()), service.findPaymentId(companyId, "k"));
    }

    @Test
    @DisplayName("A key found in the table is written back to the cache")
    void tableHitIsCached() {
        PaymentEntity stored = payment("k");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(paymentRepository.findByCompanyIdAndIdempotencyKey(companyId, "k")).thenReturn(Optional.of(stored));

        service.findPaymentId(companyId, "k");

        verify(valueOperations).set(IdempotencyService.cacheKey(companyId, "k"), stored.getId().toString(),
                Duration.ofDays(7));
    }

    @Test
    @DisplayName("A table failure surfaces as a storage error")
    void tableFailure() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(paymentRepository.findByCompanyIdAndIdempotencyKey(companyId, "k"))
                .thenThrow(new QueryTimeoutException("timeout"));

        StorageException e = assertThrows(StorageException.class, () -> service.findPaymentId(companyId, "k"));
        assertEquals(StorageException.CODE, e.getErrorCode());
    }

    @Test
    @DisplayName("Forgetting a key evicts only that company's entry")
    void forget() {
        service.forget(companyId, "k");
        service.forget(companyId, null);

        verify(redisTemplate).delete(IdempotencyService.cacheKey(companyId, "k"));
    }
}
