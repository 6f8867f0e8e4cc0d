package com.flagship.accounting_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.accounting_ledger.config.JacksonConfig;
import com.flagship.accounting_ledger.event.JournalEntryPostedEvent;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Outbox bookkeeping against a mocked repository. Atomicity with the business
 * write is covered by the integration tests.
 */
@ExtendWith(MockitoExtension.class)
class OutboxServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-20T09:00:00Z");

    @Mock
    private OutboxEventRepository repository;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private OutboxService outboxService;

    private final UUID companyId = UUID.randomUUID();
    private final UUID entryId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        outboxService = new OutboxService(repository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        CorrelationContext.end();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private JournalEntryPostedEvent posted() {
        return JournalEntryPostedEvent.of(entryId, companyId, "JE-000001", LocalDate.of(2026, 3, 20),
                new BigDecimal("1000.0000"), 2);
    }

    private OutboxEventEntity stored() {
        return OutboxEventEntity.pending(OutboxEvent.pending(posted(), "{}", null));
    }

    @Test
    @DisplayName("A saved event carries its company, the request's correlation id and a JSON payload")
    void testSaveEvent() throws Exception {
        printTestHeader("Save Event");
        CorrelationContext.begin("req-42", companyId.toString());
        when(repository.save(any(OutboxEventEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        JournalEntryPostedEvent event = posted();

        OutboxEvent saved = outboxService.saveEvent(event);

        assertEquals(event.getEventId(), saved.getId());
        assertEquals(companyId, saved.getCompanyId());
        assertEquals("JournalEntry", saved.getAggregateType());
        assertEquals(entryId, saved.getAggregateId());
        assertEquals("JournalEntryPosted", saved.getEventType());
        assertEquals("req-42", saved.getCorrelationId());
        assertFalse(saved.isPublished());
        assertEquals(0, saved.getRetryCount());

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertEquals("JE-000001", payload.get("number").asText());
        assertEquals("2026-03-20", payload.get("entryDate").asText());
        assertEquals(0, new BigDecimal("1000").compareTo(payload.get("totalAmount").decimalValue()));
    }

    @Test
    @DisplayName("Events written outside a request have no correlation id")
    void testSaveEventWithoutRequest() {
        printTestHeader("Save Event Without Request");
        when(repository.save(any(OutboxEventEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        assertNull(outboxService.saveEvent(posted()).getCorrelationId());
    }

    @Test
    @DisplayName("Publishing stamps the clock and clears the last error")
    void testMarkPublished() {
        printTestHeader("Mark Published");
        OutboxEventEntity entity = stored();
        entity.markFailed("broker unavailable");
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        outboxService.markPublished(entity.getId());

        assertEquals(NOW, entity.getPublishedAt());
        assertNull(entity.getLastError());
        assertTrue(entity.toDomain().isPublished());
    }

    @Test
    @DisplayName("Failures count retries and keep a bounded error message")
    void testMarkFailed() {
        printTestHeader("Mark Failed");
        OutboxEventEntity entity = stored();
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        outboxService.markFailed(entity.getId(), "x".repeat(5000));
        outboxService.markFailed(entity.getId(), "timeout");

        assertEquals(2, entity.getRetryCount());
        assertEquals("timeout", entity.getLastError());
        assertTrue(entity.toDomain().isDeadLettered(2));
        assertFalse(entity.toDomain().isDeadLettered(3));

        outboxService.markFailed(entity.getId(), "y".repeat(5000));
        assertEquals(OutboxEventEntity.MAX_ERROR_LENGTH, entity.getLastError().length());
    }
}
