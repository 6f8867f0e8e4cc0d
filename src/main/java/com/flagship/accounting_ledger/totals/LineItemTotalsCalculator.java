package com.flagship.accounting_ledger.totals;

import com.flagship.accounting_ledger.exception.EmptyDocumentException;
import com.flagship.accounting_ledger.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns line items into subtotal, tax and total figures.
 *
 * Per item:
 * <pre>
 *   lineSubtotal = quantity * unitPrice
 *   lineTax      = lineSubtotal * taxRate / 100
 *   lineTotal    = lineSubtotal + lineTax - discountAmount
 * </pre>
 * Each line figure is rounded to 4 decimals before it is summed, so the
 * persisted lines always add up to the persisted document figures.
 *
 * Stateless and free of I/O; safe to call from any thread.
 */
@Component
public class LineItemTotalsCalculator {

    private static final BigDecimal MAX_TAX_RATE = new BigDecimal("100");

    public DocumentTotals calculate(String documentKind, List<LineItemInput> items, BigDecimal documentDiscount) {
        if (items == null || items.isEmpty()) {
            throw new EmptyDocumentException(documentKind);
        }
        BigDecimal docDiscount = Money.normalize(documentDiscount);
        if (docDiscount.signum() < 0) {
            throw new ValidationException("Document discount cannot be negative");
        }

        List<LineItemTotals> lines = new ArrayList<>(items.size());
        BigDecimal subtotal = Money.ZERO;
        BigDecimal tax = Money.ZERO;
        BigDecimal lineDiscounts = Money.ZERO;

        for (int i = 0; i < items.size(); i++) {
            LineItemTotals line = calculateLine(i + 1, items.get(i));
            lines.add(line);
            subtotal = subtotal.add(line.getSubtotal());
            tax = tax.add(line.getTaxAmount());
            lineDiscounts = lineDiscounts.add(line.getDiscountAmount());
        }

        BigDecimal discount = lineDiscounts.add(docDiscount);
        BigDecimal total = subtotal.add(tax).subtract(discount);
        if (total.signum() < 0) {
            throw new ValidationException("Discounts exceed the document value: total would be " + total.toPlainString());
        }
        return new DocumentTotals(List.copyOf(lines), subtotal, tax, discount, total);
    }

    public LineItemTotals calculateLine(int position, LineItemInput item) {
        if (item == null) {
            throw new ValidationException("Line " + position + " is missing");
        }
        BigDecimal quantity = item.getQuantity();
        BigDecimal unitPrice = item.getUnitPrice();
        BigDecimal taxRate = Money.orZero(item.getTaxRate());
        BigDecimal discount = Money.normalize(item.getDiscountAmount());

        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Line " + position + ": quantity must be greater than 0");
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new ValidationException("Line " + position + ": unit price is required and cannot be negative");
        }
        if (taxRate.signum() < 0 || taxRate.compareTo(MAX_TAX_RATE) > 0) {
            throw new ValidationException("Line " + position + ": tax rate must be between 0 and 100");
        }
        if (discount.signum() < 0) {
            throw new ValidationException("Line " + position + ": discount cannot be negative");
        }

        BigDecimal subtotal = Money.normalize(quantity.multiply(unitPrice));
        BigDecimal taxAmount = Money.percentOf(subtotal, taxRate);
        BigDecimal total = subtotal.add(taxAmount).subtract(discount);

        return new LineItemTotals(quantity, unitPrice, taxRate, subtotal, taxAmount, discount, total);
    }
}
