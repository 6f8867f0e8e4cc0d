package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox relay meters.
 *
 * Backlog gauges are per aggregate type (Invoice, Bill, Payment,
 * JournalEntry) and read cached values; {@link #refresh()} reloads them on a
 * fixed schedule.
 */
@Component
@Slf4j
public class OutboxMetrics {

    static final List<String> AGGREGATE_TYPES = List.of("Invoice", "Bill", "Payment", "JournalEntry");

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final Map<String, AtomicLong> backlogByAggregateType = new ConcurrentHashMap<>();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository, MeterRegistry meterRegistry, Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;

        for (String aggregateType : AGGREGATE_TYPES) {
            AtomicLong backlog = new AtomicLong();
            backlogByAggregateType.put(aggregateType, backlog);
            Gauge.builder("ledger.outbox.backlog", backlog, AtomicLong::get)
                    .description("Ledger events waiting to be published")
                    .tag("aggregate_type", aggregateType)
                    .register(meterRegistry);
        }
        Gauge.builder("ledger.outbox.oldest_pending.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
                .description("Age of the oldest ledger event waiting to be published")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.dead_lettered", deadLettered, AtomicLong::get)
                .description("Ledger events that used up their publish attempts")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refresh() {
        try {
            Map<String, Long> counts = new HashMap<>();
            for (Object[] row : outboxRepository.countBacklogByAggregateType(maxRetries)) {
                counts.put((String) row[0], ((Number) row[1]).longValue());
            }
            backlogByAggregateType.forEach((type, gauge) -> gauge.set(counts.getOrDefault(type, 0L)));

            oldestPendingAgeSeconds.set(outboxRepository.findOldestPendingCreatedAt(maxRetries)
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            deadLettered.set(outboxRepository.countDeadLettered(maxRetries));

            log.debug("Outbox backlog {} (oldest {}s), dead-lettered {}",
                    counts, oldestPendingAgeSeconds.get(), deadLettered.get());
        } catch (DataAccessException e) {
            log.warn("Outbox gauges not refreshed, keeping previous values: {}", e.getMessage());
        }
    }

    public long backlog(String aggregateType) {
        AtomicLong gauge = backlogByAggregateType.get(aggregateType);
        return gauge != null ? gauge.get() : 0;
    }

    public void recordEventPublished(String aggregateType, String eventType) {
        publishCounter(aggregateType, eventType, "success").increment();
    }

    public void recordEventPublishFailed(String aggregateType, String eventType) {
        publishCounter(aggregateType, eventType, "failure").increment();
    }

    public void recordEventDeadLettered(String aggregateType, String eventType) {
        meterRegistry.counter("ledger.outbox.events.dead_lettered",
                "aggregate_type", aggregateType, "event_type", eventType).increment();
    }

    private Counter publishCounter(String aggregateType, String eventType, String outcome) {
        return meterRegistry.counter("ledger.outbox.events.published",
                "aggregate_type", aggregateType, "event_type", eventType, "outcome", outcome);
    }
}
