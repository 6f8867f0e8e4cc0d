package com.flagship.accounting_ledger.outbox;

import com.flagship.accounting_ledger.event.LedgerEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event stored in the outbox, scoped to the company whose books it
 * changed. {@code correlationId} is the id of the request that produced it and
 * travels to Kafka as a record header.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID companyId;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(LedgerEvent event, String payload, String correlationId) {
        return new OutboxEvent(
                event.getEventId(),
                event.getCompanyId(),
                event.getAggregateType(),
                event.getAggregateId(),
                event.getEventType(),
                payload,
                correlationId,
                event.getOccurredAt(),
                null,
                0,
                null,
                null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
