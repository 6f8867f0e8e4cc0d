package com.flagship.accounting_ledger.journal;

public enum JournalStatus {
    DRAFT,
    POSTED
}
