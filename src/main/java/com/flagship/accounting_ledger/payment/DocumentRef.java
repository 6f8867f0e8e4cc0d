package com.flagship.accounting_ledger.payment;

import com.flagship.accounting_ledger.document.BillableKind;
import com.flagship.accounting_ledger.exception.InvalidReferenceException;
import lombok.Value;

import java.util.UUID;

/**
 * The document a payment settles: exactly one of invoice or bill.
 */
@Value
public class DocumentRef {
    UUID invoiceId;
    UUID billId;

    public static DocumentRef invoice(UUID invoiceId) {
        return new DocumentRef(invoiceId, null);
    }

    public static DocumentRef bill(UUID billId) {
        return new DocumentRef(null, billId);
    }

    /**
     * @throws InvalidReferenceException if both or neither id is set
     */
    public BillableKind kind() {
        if (invoiceId != null && billId != null) {
            throw new InvalidReferenceException("A payment must reference either an invoice or a bill, not both");
        }
        if (invoiceId == null && billId == null) {
            throw new InvalidReferenceException("A payment must reference an invoice or a bill");
        }
        return invoiceId != null ? BillableKind.INVOICE : BillableKind.BILL;
    }

    public UUID documentId() {
        return kind() == BillableKind.INVOICE ? invoiceId : billId;
    }
}
