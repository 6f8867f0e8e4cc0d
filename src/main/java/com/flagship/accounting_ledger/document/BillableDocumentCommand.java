package com.flagship.accounting_ledger.document;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Create or update request for an invoice or bill.
 *
 * On update every null field means "leave unchanged"; a non-null
 * {@code items} list replaces all existing items.
 */
@Value
@Builder
public class BillableDocumentCommand {
    UUID counterpartyId;
    String number;
    LocalDate date;
    LocalDate dueDate;
    DocumentStatus status;
    List<LineItemCommand> items;
    BigDecimal discountAmount;
    String notes;
    String termsConditions;
}
