package com.flagship.accounting_ledger.document;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Caller's line item before product defaults are resolved.
 */
@Value
@Builder
public class LineItemCommand {
    UUID productId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal taxRate;
    BigDecimal discountAmount;
}
