package com.flagship.accounting_ledger.event;

import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.DocumentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * InvoiceCreated / InvoiceUpdated / InvoiceDeleted and the Bill equivalents.
 */
@Value
public class DocumentChangedEvent implements LedgerEvent {

    public enum Change { CREATED, UPDATED, DELETED }

    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    UUID companyId;
    UUID counterpartyId;
    String number;
    DocumentStatus status;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal balanceAmount;
    Instant occurredAt;

    public static DocumentChangedEvent of(Change change, BillableDocument document) {
        String aggregateType = document.getKind().getLabel();
        return new DocumentChangedEvent(
            UUID.randomUUID(),
            aggregateType + eventSuffix(change),
            aggregateType,
            document.getId(),
            document.getCompanyId(),
            document.getCounterpartyId(),
            document.getNumber(),
            document.getStatus(),
            document.getTotalAmount(),
            document.getPaidAmount(),
            document.getBalanceAmount(),
            Instant.now()
        );
    }

    private static String eventSuffix(Change change) {
        return switch (change) {
            case CREATED -> "Created";
            case UPDATED -> "Updated";
            case DELETED -> "Deleted";
        };
    }
}
