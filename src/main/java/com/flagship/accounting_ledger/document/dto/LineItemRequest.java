package com.flagship.accounting_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.document.LineItemCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of an invoice or bill. Unit price, tax rate and description may be
 * omitted when a product is given; the product supplies them.
 */
@Value
@Builder
@Jacksonized
public class LineItemRequest {

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @DecimalMin(value = "0", message = "Unit price cannot be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @DecimalMin(value = "0", message = "Discount cannot be negative")
    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    public LineItemCommand toCommand() {
        return LineItemCommand.builder()
                .productId(productId)
                .description(description)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .taxRate(taxRate)
                .discountAmount(discountAmount)
                .build();
    }
}
