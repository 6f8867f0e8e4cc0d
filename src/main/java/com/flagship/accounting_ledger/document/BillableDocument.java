package com.flagship.accounting_ledger.document;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read-only snapshot of an invoice or bill with its items.
 */
@Value
public class BillableDocument {
    BillableKind kind;
    UUID id;
    UUID companyId;
    UUID counterpartyId;
    String number;
    LocalDate date;
    LocalDate dueDate;
    DocumentStatus status;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal discountAmount;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal balanceAmount;
    String notes;
    String termsConditions;
    List<DocumentLine> lines;
    Instant createdAt;
    Instant updatedAt;

    public DocumentStatus effectiveStatus(LocalDate today) {
        return DocumentStatusRules.effective(status, balanceAmount, dueDate, today);
    }
}
