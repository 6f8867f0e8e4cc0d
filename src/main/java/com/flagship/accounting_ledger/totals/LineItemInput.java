package com.flagship.accounting_ledger.totals;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw figures of one line item, already resolved against product defaults.
 * Null tax rate and discount mean zero.
 */
@Value
@Builder
public class LineItemInput {
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal taxRate;
    BigDecimal discountAmount;
}
