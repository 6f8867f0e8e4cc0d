package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStatusRulesTest {

    private static final BigDecimal TOTAL = new BigDecimal("220.0000");

    @Test
    @DisplayName("Unpaid documents keep DRAFT or their issued status")
    void unpaidStatus() {
        assertEquals(DocumentStatus.DRAFT,
                DocumentStatusRules.derive(BillableKind.INVOICE, DocumentStatus.DRAFT, BigDecimal.ZERO, TOTAL));
        assertEquals(DocumentStatus.SENT,
                DocumentStatusRules.derive(BillableKind.INVOICE, DocumentStatus.SENT, BigDecimal.ZERO, TOTAL));
        assertEquals(DocumentStatus.APPROVED,
                DocumentStatusRules.derive(BillableKind.BILL, DocumentStatus.APPROVED, BigDecimal.ZERO, TOTAL));
    }

    @Test
    @DisplayName("A full reversal returns a paid document to its issued status")
    void reversalReturnsToIssued() {
        assertEquals(DocumentStatus.SENT,
                DocumentStatusRules.derive(BillableKind.INVOICE, DocumentStatus.PAID, BigDecimal.ZERO, TOTAL));
        assertEquals(DocumentStatus.APPROVED,
                DocumentStatusRules.derive(BillableKind.BILL, DocumentStatus.PARTIALLY_PAID, BigDecimal.ZERO, TOTAL));
    }

    @Test
    @DisplayName("Partial and full payment")
    void paidStatus() {
        assertEquals(DocumentStatus.PARTIALLY_PAID,
                DocumentStatusRules.derive(BillableKind.INVOICE, DocumentStatus.SENT, new BigDecimal("0.0001"), TOTAL));
        assertEquals(DocumentStatus.PAID,
                DocumentStatusRules.derive(BillableKind.INVOICE, DocumentStatus.PARTIALLY_PAID, TOTAL, TOTAL));
        assertEquals(DocumentStatus.PAID,
                DocumentStatusRules.derive(BillableKind.BILL, DocumentStatus.DRAFT, new BigDecimal("220"), TOTAL));
    }

    @Test
    @DisplayName("New documents are DRAFT or issued; anything else is rejected")
    void initialStatus() {
        assertEquals(DocumentStatus.DRAFT, DocumentStatusRules.initial(BillableKind.INVOICE, null));
        assertEquals(DocumentStatus.SENT, DocumentStatusRules.initial(BillableKind.INVOICE, DocumentStatus.SENT));
        assertEquals(DocumentStatus.APPROVED, DocumentStatusRules.initial(BillableKind.BILL, DocumentStatus.APPROVED));

        assertThrows(ValidationException.class,
                () -> DocumentStatusRules.initial(BillableKind.INVOICE, DocumentStatus.APPROVED));
        assertThrows(ValidationException.class,
                () -> DocumentStatusRules.initial(BillableKind.BILL, DocumentStatus.PAID));
        assertThrows(ValidationException.class,
                () -> DocumentStatusRules.initial(BillableKind.INVOICE, DocumentStatus.OVERDUE));
    }

    @Test
    @DisplayName("Issue toggle is allowed only while nothing is paid")
    void resolveRequestedStatus() {
        assertEquals(DocumentStatus.SENT, DocumentStatusRules.resolve(BillableKind.INVOICE,
                DocumentStatus.DRAFT, DocumentStatus.SENT, BigDecimal.ZERO, TOTAL));
        assertEquals(DocumentStatus.DRAFT, DocumentStatusRules.resolve(BillableKind.INVOICE,
                DocumentStatus.SENT, DocumentStatus.DRAFT, BigDecimal.ZERO, TOTAL));

        assertThrows(ValidationException.class, () -> DocumentStatusRules.resolve(BillableKind.INVOICE,
                DocumentStatus.PARTIALLY_PAID, DocumentStatus.DRAFT, BigDecimal.TEN, TOTAL));
        assertThrows(ValidationException.class, () -> DocumentStatusRules.resolve(BillableKind.INVOICE,
                DocumentStatus.SENT, DocumentStatus.PAID, BigDecimal.ZERO, TOTAL));
    }

    @Test
    @DisplayName("Requesting the current status is a no-op even with payments")
    void resolveSameStatus() {
        assertEquals(DocumentStatus.PARTIALLY_PAID, DocumentStatusRules.resolve(BillableKind.BILL,
                DocumentStatus.PARTIALLY_PAID, DocumentStatus.PARTIALLY_PAID, BigDecimal.TEN, TOTAL));
    }

    @Test
    @DisplayName("OVERDUE is shown only for issued, unpaid, past-due documents")
    void effectiveStatus() {
        LocalDate due = LocalDate.of(2026, 3, 31);
        LocalDate after = due.plusDays(1);

        assertEquals(DocumentStatus.OVERDUE,
                DocumentStatusRules.effective(DocumentStatus.SENT, TOTAL, due, after));
        assertEquals(DocumentStatus.OVERDUE,
                DocumentStatusRules.effective(DocumentStatus.PARTIALLY_PAID, BigDecimal.ONE, due, after));

        assertEquals(DocumentStatus.SENT, DocumentStatusRules.effective(DocumentStatus.SENT, TOTAL, due, due));
        assertEquals(DocumentStatus.DRAFT, DocumentStatusRules.effective(DocumentStatus.DRAFT, TOTAL, due, after));
        assertEquals(DocumentStatus.PAID,
                DocumentStatusRules.effective(DocumentStatus.PAID, BigDecimal.ZERO, due, after));
    }
}
