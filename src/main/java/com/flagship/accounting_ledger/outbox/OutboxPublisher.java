package com.flagship.accounting_ledger.outbox;

import com.flagship.accounting_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Relays outbox rows to the ledger-events topic.
 *
 * Records are keyed by company id so every event of one set of books lands
 * on the same partition, in commit order. The event type, company and
 * originating correlation id are copied to record headers. A row is marked
 * published only after the broker acknowledged it; after {@code max-retries}
 * failed attempts it stays in the table as dead-lettered.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";
    static final String COMPANY_ID_HEADER = "company-id";
    static final String CORRELATION_ID_HEADER = "correlation-id";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.lockPublishableBatch(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, retrying on the next poll", e);
            return;
        }
        if (!batch.isEmpty()) {
            log.debug("Publishing {} outbox events", batch.size());
            batch.forEach(this::publishEvent);
        }
    }

    void publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate.send(toRecord(event)).get();
            log.debug("Published {} for {} {} to partition {} offset {}",
                    event.getEventType(), event.getAggregateType(), event.getAggregateId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getAggregateType(), event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "publisher interrupted");
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("Failed to publish {} for {} {}: {}",
                    event.getEventType(), event.getAggregateType(), event.getAggregateId(), cause.getMessage());
            recordFailure(event, cause.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getAggregateType(), event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Outbox event {} ({} for {} {}) dead-lettered after {} attempts",
                    event.getId(), event.getEventType(), event.getAggregateType(), event.getAggregateId(),
                    maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getAggregateType(), event.getEventType());
        }
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                ledgerEventsTopic, event.getCompanyId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(COMPANY_ID_HEADER, event.getCompanyId().toString().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CORRELATION_ID_HEADER, event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
