package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.ledger.LedgerEffect;
import com.flagship.accounting_ledger.numbering.DocumentType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Invoice and bill differ only in their counterparty and their issued status;
 * everything else in the lifecycle is shared.
 */
@Getter
@RequiredArgsConstructor
public enum BillableKind {
    INVOICE("Invoice", "Customer", DocumentStatus.SENT, DocumentType.INVOICE),
    BILL("Bill", "Supplier", DocumentStatus.APPROVED, DocumentType.BILL);

    private final String label;
    private final String counterpartyLabel;
    private final DocumentStatus issuedStatus;
    private final DocumentType documentType;

    /**
     * Balance effect on the counterparty: customers' receivable for invoices,
     * suppliers' payable for bills.
     */
    public LedgerEffect counterpartyEffect(UUID counterpartyId, BigDecimal delta) {
        return this == INVOICE
                ? LedgerEffect.customer(counterpartyId, delta)
                : LedgerEffect.supplier(counterpartyId, delta);
    }
}
