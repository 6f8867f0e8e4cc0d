package com.flagship.accounting_ledger.company.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateCompanyRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;

    @JsonProperty("base_currency")
    String baseCurrency;

    @JsonProperty("tax_id")
    String taxId;
}
