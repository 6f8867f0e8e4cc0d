package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthIndicatorsTest {

    private static final Instant NOW = Instant.parse("2026-03-20T09:00:00Z");

    @Mock
    private OutboxEventRepository outboxRepository;

    @Mock
    private RedisConnectionFactory redisConnectionFactory;

    @Mock
    private RedisConnection redisConnection;

    private HealthIndicators.LedgerOutboxHealthIndicator outboxIndicator() {
        return new HealthIndicators.LedgerOutboxHealthIndicator(outboxRepository, Clock.fixed(NOW, ZoneOffset.UTC),
                5, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Outbox is UP while the publish lag stays under the limit")
    void outboxUpWithinLag() {
        when(outboxRepository.findOldestPendingCreatedAt(5)).thenReturn(Optional.of(NOW.minusSeconds(30)));
        when(outboxRepository.countDeadLettered(5)).thenReturn(2L);

        Health health = outboxIndicator().health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(30L, health.getDetails().get("publishLagSeconds"));
        assertEquals(2L, health.getDetails().get("deadLettered"));
    }

    @Test
    @DisplayName("Outbox is DOWN once the oldest pending event is older than the limit")
    void outboxDownPastLag() {
        when(outboxRepository.findOldestPendingCreatedAt(5)).thenReturn(Optional.of(NOW.minusSeconds(600)));
        when(outboxRepository.countDeadLettered(5)).thenReturn(0L);

        assertEquals(Status.DOWN, outboxIndicator().health().getStatus());
    }

    @Test
    @DisplayName("Outbox is DOWN when the database cannot be queried")
    void outboxDownOnDatabaseError() {
        when(outboxRepository.findOldestPendingCreatedAt(5)).thenThrow(new QueryTimeoutException("timeout"));

        assertEquals(Status.DOWN, outboxIndicator().health().getStatus());
    }

    @Test
    @DisplayName("Idempotency cache is UP on PONG and DEGRADED when Redis is unreachable")
    void idempotencyCache() {
        HealthIndicators.IdempotencyCacheHealthIndicator indicator =
                new HealthIndicators.IdempotencyCacheHealthIndicator(redisConnectionFactory);

        when(redisConnectionFactory.getConnection()).thenReturn(redisConnection);
        when(redisConnection.ping()).thenReturn("PONG");
        assertEquals(Status.UP, indicator.health().getStatus());

        when(redisConnectionFactory.getConnection())
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        Health degraded = indicator.health();
        assertEquals("DEGRADED", degraded.getStatus().getCode());
        assertEquals("connection refused", degraded.getDetails().get("reason"));
    }
}
