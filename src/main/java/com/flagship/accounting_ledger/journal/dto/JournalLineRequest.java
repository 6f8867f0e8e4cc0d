package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.journal.JournalLineCommand;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class JournalLineRequest {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("description")
    String description;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    public JournalLineCommand toCommand() {
        return JournalLineCommand.builder()
                .accountId(accountId)
                .description(description)
                .debit(debit)
                .credit(credit)
                .build();
    }
}
