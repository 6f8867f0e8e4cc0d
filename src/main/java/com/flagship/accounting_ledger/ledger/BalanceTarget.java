package com.flagship.accounting_ledger.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of record that carry a running balance.
 */
@Getter
@RequiredArgsConstructor
public enum BalanceTarget {
    CUSTOMER("customers", "Customer"),
    SUPPLIER("suppliers", "Supplier"),
    ACCOUNT("accounts", "Account");

    private final String table;
    private final String label;
}
