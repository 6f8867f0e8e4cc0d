package com.flagship.accounting_ledger.party.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.party.Party;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PartyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("credit_period_days")
    int creditPeriodDays;

    @JsonProperty("balance")
    BigDecimal balance;

    public static PartyResponse from(Party party) {
        return new PartyResponse(party.getId(), party.getCompanyId(), party.getCode(), party.getName(),
                party.getEmail(), party.getPhone(), party.getCreditLimit(), party.getCreditPeriodDays(),
                party.getBalance());
    }
}
