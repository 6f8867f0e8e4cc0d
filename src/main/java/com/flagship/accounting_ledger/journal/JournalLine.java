package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class JournalLine {
    UUID id;
    int position;
    UUID accountId;
    String description;
    BigDecimal debit;
    BigDecimal credit;
}
