package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.journal.JournalEntryCommand;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * {@code post} defaults to true; {@code false} stores the entry as a draft.
 * Ignored on draft updates.
 */
@Value
@Builder
@Jacksonized
public class JournalEntryRequest {

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("post")
    Boolean post;

    @JsonProperty("lines")
    List<JournalLineRequest> lines;

    public boolean shouldPost() {
        return post == null || post;
    }

    public JournalEntryCommand toCommand() {
        return JournalEntryCommand.builder()
                .number(entryNumber)
                .date(entryDate)
                .description(description)
                .lines(lines == null ? null : lines.stream().map(JournalLineRequest::toCommand).toList())
                .build();
    }
}
