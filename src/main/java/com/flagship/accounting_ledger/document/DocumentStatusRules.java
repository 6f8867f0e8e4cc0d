package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Status is derived from the paid amount, not set freely.
 *
 * <pre>
 *   paid == 0           -> DRAFT if never issued, otherwise SENT / APPROVED
 *   0 < paid < total    -> PARTIALLY_PAID
 *   paid >= total       -> PAID
 * </pre>
 * The only explicit change a caller may ask for is issuing or un-issuing an
 * unpaid document (DRAFT to SENT/APPROVED and back).
 */
public final class DocumentStatusRules {

    private DocumentStatusRules() {
        // Utility class
    }

    public static DocumentStatus derive(BillableKind kind, DocumentStatus current,
                                        BigDecimal paidAmount, BigDecimal totalAmount) {
        if (paidAmount.signum() == 0) {
            return current == DocumentStatus.DRAFT ? DocumentStatus.DRAFT : kind.getIssuedStatus();
        }
        if (paidAmount.compareTo(totalAmount) < 0) {
            return DocumentStatus.PARTIALLY_PAID;
        }
        return DocumentStatus.PAID;
    }

    /**
     * Resolves the initial status of a new document. Defaults to DRAFT.
     */
    public static DocumentStatus initial(BillableKind kind, DocumentStatus requested) {
        if (requested == null || requested == DocumentStatus.DRAFT) {
            return DocumentStatus.DRAFT;
        }
        if (requested == kind.getIssuedStatus()) {
            return requested;
        }
        throw new ValidationException("A new " + kind.getLabel().toLowerCase()
                + " can only be created as DRAFT or " + kind.getIssuedStatus());
    }

    /**
     * Applies a caller's status request to an existing document, then re-derives.
     */
    public static DocumentStatus resolve(BillableKind kind, DocumentStatus current, DocumentStatus requested,
                                         BigDecimal paidAmount, BigDecimal totalAmount) {
        DocumentStatus base = current;
        if (requested != null && requested != current) {
            if (requested != DocumentStatus.DRAFT && requested != kind.getIssuedStatus()) {
                throw new ValidationException("Status " + requested + " is derived from payments and cannot be set");
            }
            if (paidAmount.signum() > 0) {
                throw new ValidationException("Cannot change status of a " + kind.getLabel().toLowerCase()
                        + " with payments applied to " + requested);
            }
            base = requested;
        }
        return derive(kind, base, paidAmount, totalAmount);
    }

    /**
     * Status as shown to readers: OVERDUE when an issued document still has a
     * balance after its due date.
     */
    public static DocumentStatus effective(DocumentStatus stored, BigDecimal balanceAmount,
                                           LocalDate dueDate, LocalDate today) {
        boolean open = stored != DocumentStatus.DRAFT && stored != DocumentStatus.PAID;
        if (open && balanceAmount.signum() > 0 && dueDate != null && today.isAfter(dueDate)) {
            return DocumentStatus.OVERDUE;
        }
        return stored;
    }
}
