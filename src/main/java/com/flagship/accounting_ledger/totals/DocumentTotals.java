package com.flagship.accounting_ledger.totals;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate figures of a billable document.
 *
 * {@code discountAmount} is the sum of the line discounts plus the
 * document-level discount, so that
 * {@code totalAmount == subtotal + taxAmount - discountAmount} holds exactly.
 */
@Value
public class DocumentTotals {
    List<LineItemTotals> lines;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal discountAmount;
    BigDecimal totalAmount;

    public boolean isConsistent() {
        return subtotal.add(taxAmount).subtract(discountAmount).compareTo(totalAmount) == 0;
    }
}
