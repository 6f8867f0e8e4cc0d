package com.flagship.accounting_ledger.party;

import com.flagship.accounting_ledger.numbering.DocumentType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PartyKind {
    CUSTOMER("Customer", DocumentType.CUSTOMER),
    SUPPLIER("Supplier", DocumentType.SUPPLIER);

    private final String label;
    private final DocumentType documentType;
}
