package com.flagship.accounting_ledger.document;

/**
 * Status of an invoice or bill.
 *
 * SENT is the issued state of an invoice, APPROVED the issued state of a bill.
 * OVERDUE is advisory: it is computed when a document is read and never stored.
 */
public enum DocumentStatus {
    DRAFT,
    SENT,
    APPROVED,
    PARTIALLY_PAID,
    PAID,
    OVERDUE
}
