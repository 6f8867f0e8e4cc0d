package com.flagship.accounting_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.document.DocumentLine;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LineItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("position")
    int position;

    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    public static LineItemResponse from(DocumentLine line) {
        return new LineItemResponse(line.getId(), line.getProductId(), line.getPosition(), line.getDescription(),
                line.getQuantity(), line.getUnitPrice(), line.getTaxRate(), line.getDiscountAmount(),
                line.getTaxAmount(), line.getTotalAmount());
    }
}
