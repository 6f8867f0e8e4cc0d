package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.journal.JournalEntry;
import com.flagship.accounting_ledger.journal.JournalLine;
import com.flagship.accounting_ledger.journal.JournalStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    JournalStatus status;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class Line {
        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("description")
        String description;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        static Line from(JournalLine line) {
            return new Line(line.getAccountId(), line.getDescription(), line.getDebit(), line.getCredit());
        }
    }

    public static JournalEntryResponse from(JournalEntry entry) {
        return new JournalEntryResponse(entry.getId(), entry.getNumber(), entry.getEntryDate(),
                entry.getDescription(), entry.getStatus(), entry.getTotalDebit(), entry.getTotalCredit(),
                entry.getLines().stream().map(Line::from).toList(), entry.getCreatedAt());
    }
}
