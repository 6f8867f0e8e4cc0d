package com.flagship.accounting_ledger.party.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Customer or supplier creation. {@code code} is generated when omitted;
 * {@code credit_limit} is ignored for suppliers.
 */
@Value
@Builder
@Jacksonized
public class CreatePartyRequest {

    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;

    @JsonProperty("phone")
    String phone;

    @DecimalMin(value = "0", message = "Credit limit cannot be negative")
    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @Min(value = 0, message = "Credit period cannot be negative")
    @JsonProperty("credit_period_days")
    Integer creditPeriodDays;
}
