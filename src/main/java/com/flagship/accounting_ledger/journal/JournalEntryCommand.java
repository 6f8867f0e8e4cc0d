package com.flagship.accounting_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Input for posting or drafting an entry. On draft updates a null
 * {@code lines} keeps the current lines.
 */
@Value
@Builder
public class JournalEntryCommand {
    String number;
    LocalDate date;
    String description;
    List<JournalLineCommand> lines;
}
