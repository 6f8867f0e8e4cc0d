package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Actuator indicators for the ledger's event relay and idempotency cache.
 */
public final class HealthIndicators {

    private HealthIndicators() {
    }

    /**
     * DOWN when the oldest unpublished ledger event is older than
     * {@code outbox.health.max-lag}; dead-lettered events only show as a detail
     * since they need an operator, not a restart.
     */
    @Component("ledgerOutbox")
    public static class LedgerOutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final Clock clock;
        private final int maxRetries;
        private final Duration maxLag;

        public LedgerOutboxHealthIndicator(OutboxEventRepository outboxRepository, Clock clock,
                                           @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                                           @Value("${outbox.health.max-lag:PT5M}") Duration maxLag) {
            this.outboxRepository = outboxRepository;
            this.clock = clock;
            this.maxRetries = maxRetries;
            this.maxLag = maxLag;
        }

        @Override
        public Health health() {
            try {
                Optional<Instant> oldest = outboxRepository.findOldestPendingCreatedAt(maxRetries);
                Duration lag = oldest.map(created -> Duration.between(created, clock.instant()))
                        .orElse(Duration.ZERO);
                Health.Builder builder = lag.compareTo(maxLag) > 0 ? Health.down() : Health.up();
                return builder
                        .withDetail("publishLagSeconds", Math.max(0, lag.getSeconds()))
                        .withDetail("maxLagSeconds", maxLag.getSeconds())
                        .withDetail("deadLettered", outboxRepository.countDeadLettered(maxRetries))
                        .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis caches idempotency keys only. Payments still deduplicate through
     * the database when it is unreachable, so an outage reports DEGRADED.
     */
    @Component("idempotencyCache")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final RedisConnectionFactory connectionFactory;

        public IdempotencyCacheHealthIndicator(RedisConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong) ? Health.up().build() : degraded("ping returned " + pong);
            } catch (RedisConnectionFailureException e) {
                return degraded(e.getMessage());
            }
        }

        private static Health degraded(String reason) {
            return Health.status("DEGRADED")
                    .withDetail("reason", String.valueOf(reason))
                    .withDetail("fallback", "payments.idempotency_key")
                    .build();
        }
    }
}
