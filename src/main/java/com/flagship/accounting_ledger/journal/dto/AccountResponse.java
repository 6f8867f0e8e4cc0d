package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.journal.Account;
import com.flagship.accounting_ledger.journal.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountResponse from(Account account) {
        return new AccountResponse(account.getId(), account.getCode(), account.getName(), account.getType(),
                account.getParentId(), account.getBalance());
    }
}
