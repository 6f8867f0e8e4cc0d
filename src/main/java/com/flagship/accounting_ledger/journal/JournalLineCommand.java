package com.flagship.accounting_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class JournalLineCommand {
    UUID accountId;
    String description;
    BigDecimal debit;
    BigDecimal credit;
}
