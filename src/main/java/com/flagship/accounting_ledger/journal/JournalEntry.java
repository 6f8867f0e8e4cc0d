package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class JournalEntry {
    UUID id;
    UUID companyId;
    String number;
    LocalDate entryDate;
    String description;
    JournalStatus status;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    List<JournalLine> lines;
    Instant createdAt;
    Instant updatedAt;
}
