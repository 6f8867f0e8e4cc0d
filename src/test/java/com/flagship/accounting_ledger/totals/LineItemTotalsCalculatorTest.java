package com.flagship.accounting_ledger.totals;

import com.flagship.accounting_ledger.exception.EmptyDocumentException;
import com.flagship.accounting_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineItemTotalsCalculatorTest {

    private final LineItemTotalsCalculator calculator = new LineItemTotalsCalculator();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static LineItemInput item(String quantity, String unitPrice, String taxRate, String discount) {
        return LineItemInput.builder()
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(unitPrice))
                .taxRate(taxRate == null ? null : new BigDecimal(taxRate))
                .discountAmount(discount == null ? null : new BigDecimal(discount))
                .build();
    }

    @Test
    @DisplayName("2 x 100 at 10% tax gives 200 / 20 / 220")
    void singleLineWithTax() {
        printTestHeader("Single Line With Tax");

        DocumentTotals totals = calculator.calculate("Invoice", List.of(item("2", "100", "10", null)), null);

        printOutput("Totals", totals);
        assertEquals(0, new BigDecimal("200").compareTo(totals.getSubtotal()));
        assertEquals(0, new BigDecimal("20").compareTo(totals.getTaxAmount()));
        assertEquals(0, BigDecimal.ZERO.compareTo(totals.getDiscountAmount()));
        assertEquals(0, new BigDecimal("220").compareTo(totals.getTotalAmount()));
        assertEquals(Money.SCALE, totals.getTotalAmount().scale());
        assertTrue(totals.isConsistent());
    }

    @Test
    @DisplayName("Line discounts and the document discount both reduce the total")
    void discountsAreSubtracted() {
        DocumentTotals totals = calculator.calculate("Invoice", List.of(
                item("1", "50", "0", "5"),
                item("3", "10", "20", null)
        ), new BigDecimal("2.5"));

        // line 1: 50 - 5 = 45; line 2: 30 + 6 = 36; minus 2.5
        assertEquals(0, new BigDecimal("80").compareTo(totals.getSubtotal()));
        assertEquals(0, new BigDecimal("6").compareTo(totals.getTaxAmount()));
        assertEquals(0, new BigDecimal("7.5").compareTo(totals.getDiscountAmount()));
        assertEquals(0, new BigDecimal("78.5").compareTo(totals.getTotalAmount()));
        assertEquals(0, new BigDecimal("45").compareTo(totals.getLines().get(0).getTotalAmount()));
        assertEquals(0, new BigDecimal("36").compareTo(totals.getLines().get(1).getTotalAmount()));
    }

    @Test
    @DisplayName("Line figures are rounded half-even to 4 decimals before summing")
    void roundsEachLine() {
        DocumentTotals totals = calculator.calculate("Bill", List.of(
                item("3", "0.33333", "7.5", null),
                item("1", "0.00005", "0", null)
        ), null);

        LineItemTotals first = totals.getLines().get(0);
        assertEquals(new BigDecimal("1.0000"), first.getSubtotal());
        assertEquals(new BigDecimal("0.0750"), first.getTaxAmount());
        // 0.00005 rounds half-even to 0.0000
        assertEquals(new BigDecimal("0.0000"), totals.getLines().get(1).getSubtotal());
        assertEquals(new BigDecimal("1.0750"), totals.getTotalAmount());
        assertTrue(totals.isConsistent());
    }

    @Test
    @DisplayName("Empty item list is rejected")
    void emptyItemsRejected() {
        EmptyDocumentException e = assertThrows(EmptyDocumentException.class,
                () -> calculator.calculate("Invoice", List.of(), null));
        assertEquals(EmptyDocumentException.CODE, e.getErrorCode());

        assertThrows(EmptyDocumentException.class, () -> calculator.calculate("Invoice", null, null));
    }

    @Test
    @DisplayName("Invalid line figures are rejected with a validation error")
    void invalidLinesRejected() {
        assertThrows(ValidationException.class,
                () -> calculator.calculate("Invoice", List.of(item("0", "10", null, null)), null));
        assertThrows(ValidationException.class,
                () -> calculator.calculate("Invoice", List.of(item("1", "-1", null, null)), null));
        assertThrows(ValidationException.class,
                () -> calculator.calculate("Invoice", List.of(item("1", "10", "100.01", null)), null));
        assertThrows(ValidationException.class,
                () -> calculator.calculate("Invoice", List.of(item("1", "10", "-1", null)), null));
        assertThrows(ValidationException.class,
                () -> calculator.calculate("Invoice", List.of(item("1", "10", null, "-0.01")), null));
    }

    @Test
    @DisplayName("Discounts larger than the document value are rejected")
    void negativeTotalRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> calculator.calculate("Invoice", List.of(item("1", "10", null, null)), new BigDecimal("10.01")));
        assertTrue(e.getMessage().contains("Discounts exceed"));
    }

    @Test
    @DisplayName("Zero-priced lines are allowed")
    void zeroPriceAllowed() {
        DocumentTotals totals = calculator.calculate("Invoice", List.of(item("5", "0", "18", null)), null);
        assertEquals(Money.ZERO, totals.getTotalAmount());
    }
}
