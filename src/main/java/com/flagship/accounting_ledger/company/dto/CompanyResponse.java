package com.flagship.accounting_ledger.company.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.company.CompanyEntity;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CompanyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("tax_id")
    String taxId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CompanyResponse from(CompanyEntity company) {
        return new CompanyResponse(company.getId(), company.getName(), company.getEmail(),
                company.getBaseCurrency(), company.getTaxId(), company.getCreatedAt());
    }
}
