package com.flagship.accounting_ledger.totals;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Computed figures for one line item. Every amount is at {@link Money#SCALE}.
 */
@Value
public class LineItemTotals {
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal taxRate;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal discountAmount;
    BigDecimal totalAmount;
}
