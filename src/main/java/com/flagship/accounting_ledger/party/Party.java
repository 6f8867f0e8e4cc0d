package com.flagship.accounting_ledger.party;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Customer or supplier snapshot.
 */
@Value
public class Party {
    PartyKind kind;
    UUID id;
    UUID companyId;
    String code;
    String name;
    String email;
    String phone;
    BigDecimal creditLimit;
    int creditPeriodDays;
    BigDecimal balance;
}
