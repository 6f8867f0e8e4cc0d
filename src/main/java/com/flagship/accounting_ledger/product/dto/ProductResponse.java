package com.flagship.accounting_ledger.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.product.ProductEntity;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ProductResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @JsonProperty("purchase_price")
    BigDecimal purchasePrice;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    public static ProductResponse from(ProductEntity product) {
        return new ProductResponse(product.getId(), product.getCode(), product.getName(), product.getUnit(),
                product.getSellingPrice(), product.getPurchasePrice(), product.getTaxRate());
    }
}
