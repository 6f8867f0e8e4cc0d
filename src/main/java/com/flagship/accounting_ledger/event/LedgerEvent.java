package com.flagship.accounting_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Integration event written to the outbox when a ledger change commits.
 * Serialized to JSON as-is; consumers key on {@code eventType}.
 */
public interface LedgerEvent {

    UUID getEventId();

    String getEventType();

    String getAggregateType();

    UUID getAggregateId();

    UUID getCompanyId();

    Instant getOccurredAt();
}
