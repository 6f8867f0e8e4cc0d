package com.flagship.accounting_ledger.document;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class DocumentLine {
    UUID id;
    UUID productId;
    int position;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal taxRate;
    BigDecimal discountAmount;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
}
