package com.flagship.accounting_ledger.numbering;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Every numbered record kind, with its prefix and the table/column holding
 * the number. The (company_id, column) pair is unique in each table.
 */
@Getter
@RequiredArgsConstructor
public enum DocumentType {
    INVOICE("INV", true, "invoices", "number"),
    BILL("BILL", true, "bills", "number"),
    PAYMENT("PAY", false, "payments", "number"),
    EXPENSE("EXP", false, "expenses", "number"),
    JOURNAL_ENTRY("JE", false, "journal_entries", "number"),
    CUSTOMER("CUST", false, "customers", "code"),
    SUPPLIER("SUPP", false, "suppliers", "code"),
    PRODUCT("PROD", false, "products", "code"),
    ACCOUNT("ACC", false, "accounts", "code");

    private final String prefix;
    private final boolean yearScoped;
    private final String table;
    private final String numberColumn;
}
