package com.flagship.accounting_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class JournalEntryPostedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "JournalEntryPosted";
    public static final String AGGREGATE_TYPE = "JournalEntry";

    UUID eventId;
    UUID aggregateId;
    UUID companyId;
    String number;
    LocalDate entryDate;
    BigDecimal totalAmount;
    int lineCount;
    Instant occurredAt;

    public static JournalEntryPostedEvent of(UUID entryId, UUID companyId, String number, LocalDate entryDate,
                                             BigDecimal totalAmount, int lineCount) {
        return new JournalEntryPostedEvent(UUID.randomUUID(), entryId, companyId, number, entryDate,
                totalAmount, lineCount, Instant.now());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }
}
