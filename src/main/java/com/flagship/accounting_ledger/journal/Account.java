package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class Account {
    UUID id;
    UUID companyId;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    BigDecimal balance;
    Instant createdAt;
}
