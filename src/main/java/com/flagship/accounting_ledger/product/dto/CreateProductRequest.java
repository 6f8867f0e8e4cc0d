package com.flagship.accounting_ledger.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateProductRequest {

    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("unit")
    String unit;

    @DecimalMin(value = "0", message = "Selling price cannot be negative")
    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @DecimalMin(value = "0", message = "Purchase price cannot be negative")
    @JsonProperty("purchase_price")
    BigDecimal purchasePrice;

    @DecimalMin(value = "0", message = "Tax rate cannot be negative")
    @DecimalMax(value = "100", message = "Tax rate cannot exceed 100")
    @JsonProperty("tax_rate")
    BigDecimal taxRate;
}
