package com.flagship.accounting_ledger.journal;

import java.math.BigDecimal;

/**
 * Chart-of-accounts class. Assets and expenses grow with debits; the other
 * classes grow with credits.
 */
public enum AccountType {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    REVENUE(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountType(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    public boolean isDebitNormal() {
        return debitNormal;
    }

    /**
     * Balance change caused by one journal line on an account of this type.
     */
    public BigDecimal signedEffect(BigDecimal debit, BigDecimal credit) {
        BigDecimal net = debit.subtract(credit);
        return debitNormal ? net : net.negate();
    }
}
