package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxMetricsTest {

    private static final Instant NOW = Instant.parse("2026-03-20T09:00:00Z");

    @Mock
    private OutboxEventRepository outboxRepository;

    private SimpleMeterRegistry meterRegistry;
    private OutboxMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new OutboxMetrics(outboxRepository, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC), 5);
    }

    private double gauge(String name, String aggregateType) {
        return meterRegistry.get(name).tag("aggregate_type", aggregateType).gauge().value();
    }

    @Test
    @DisplayName("Backlog is reported per aggregate type, absent types read zero")
    void refreshesBacklogPerAggregateType() {
        when(outboxRepository.countBacklogByAggregateType(5)).thenReturn(List.of(
                new Object[]{"Invoice", 7L},
                new Object[]{"Payment", 2L}));
        when(outboxRepository.findOldestPendingCreatedAt(5)).thenReturn(Optional.of(NOW.minusSeconds(90)));
        when(outboxRepository.countDeadLettered(5)).thenReturn(1L);

        metrics.refresh();

        assertEquals(7.0, gauge("ledger.outbox.backlog", "Invoice"));
        assertEquals(2.0, gauge("ledger.outbox.backlog", "Payment"));
        assertEquals(0.0, gauge("ledger.outbox.backlog", "Bill"));
        assertEquals(0.0, gauge("ledger.outbox.backlog", "JournalEntry"));
        assertEquals(90.0, meterRegistry.get("ledger.outbox.oldest_pending.age.seconds").gauge().value());
        assertEquals(1.0, meterRegistry.get("ledger.outbox.dead_lettered").gauge().value());
    }

    @Test
    @DisplayName("A failed refresh keeps the previous values")
    void keepsValuesWhenDatabaseFails() {
        when(outboxRepository.countBacklogByAggregateType(5))
                .thenReturn(List.<Object[]>of(new Object[]{"Bill", 3L}))
                .thenThrow(new QueryTimeoutException("timeout"));
        when(outboxRepository.findOldestPendingCreatedAt(5)).thenReturn(Optional.empty());
        when(outboxRepository.countDeadLettered(5)).thenReturn(0L);

        metrics.refresh();
        assertDoesNotThrow(() -> metrics.refresh());

        assertEquals(3, metrics.backlog("Bill"));
        assertEquals(0, metrics.backlog("Unknown"));
    }

    @Test
    @DisplayName("Publish outcomes are counted by aggregate and event type")
    void countsPublishOutcomes() {
        metrics.recordEventPublished("Payment", "PaymentApplied");
        metrics.recordEventPublished("Payment", "PaymentApplied");
        metrics.recordEventPublishFailed("Payment", "PaymentApplied");
        metrics.recordEventDeadLettered("Bill", "BillCreated");

        assertEquals(2.0, meterRegistry.get("ledger.outbox.events.published")
                .tags("aggregate_type", "Payment", "event_type", "PaymentApplied", "outcome", "success")
                .counter().count());
        assertEquals(1.0, meterRegistry.get("ledger.outbox.events.published")
                .tags("outcome", "failure").counter().count());
        assertEquals(1.0, meterRegistry.get("ledger.outbox.events.dead_lettered")
                .tags("aggregate_type", "Bill").counter().count());
    }
}
