package com.flagship.accounting_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.accounting_ledger.event.LedgerEvent;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Records ledger events in the outbox as part of the document, payment or
 * journal transaction that produced them. A rolled-back change leaves no
 * event behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LedgerEvent event) {
        OutboxEvent pending = OutboxEvent.pending(event, toJson(event), CorrelationContext.currentCorrelationId());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(pending));

        log.debug("Outbox event recorded: {} for {} {} (company {})",
                event.getEventType(), event.getAggregateType(), event.getAggregateId(), event.getCompanyId());
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> lockPublishableBatch(int limit, int maxRetries) {
        return repository.lockPublishableBatch(limit, maxRetries).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.markPublished(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String error) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(error);
            log.warn("Outbox event {} failed to publish (attempt {}): {}", eventId, entity.getRetryCount(), error);
        });
    }

    /**
     * Events recorded for one invoice, bill, payment or journal entry of a company, oldest first.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(UUID companyId, String aggregateType, UUID aggregateId) {
        return repository.findByCompanyIdAndAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                        companyId, aggregateType, aggregateId).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    private String toJson(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.getEventType() + " event", e);
        }
    }
}
