package com.flagship.accounting_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * <ul>
 *   <li>ledger.documents.created / ledger.documents.deleted, tagged by type</li>
 *   <li>ledger.payments, tagged by document kind and action (applied, reversed)</li>
 *   <li>ledger.journal.posted</li>
 *   <li>ledger.numbering.retries, tagged by type</li>
 *   <li>idempotency.cache, tagged hit / miss</li>
 *   <li>ledger.latency timer, tagged by operation</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter journalEntriesPosted;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.journalEntriesPosted = Counter.builder("ledger.journal.posted")
                .description("Number of journal entries posted")
                .register(registry);
    }

    public void recordDocumentCreated(String documentType) {
        registry.counter("ledger.documents.created", "type", sanitizeTag(documentType)).increment();
    }

    public void recordDocumentDeleted(String documentType) {
        registry.counter("ledger.documents.deleted", "type", sanitizeTag(documentType)).increment();
    }

    public void recordPaymentApplied(String documentKind) {
        registry.counter("ledger.payments",
                "kind", sanitizeTag(documentKind),
                "action", "applied"
        ).increment();
    }

    public void recordPaymentReversed(String documentKind) {
        registry.counter("ledger.payments",
                "kind", sanitizeTag(documentKind),
                "action", "reversed"
        ).increment();
    }

    public void recordJournalEntryPosted() {
        journalEntriesPosted.increment();
    }

    /**
     * A generated number collided with a concurrent insert and was re-derived.
     */
    public void recordNumberingRetry(String documentType) {
        registry.counter("ledger.numbering.retries", "type", sanitizeTag(documentType)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
