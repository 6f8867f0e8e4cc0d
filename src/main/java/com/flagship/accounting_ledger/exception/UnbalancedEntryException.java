package com.flagship.accounting_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class UnbalancedEntryException extends LedgerException {

    public static final String CODE = "UNBALANCED_ENTRY";

    private final BigDecimal totalDebit;
    private final BigDecimal totalCredit;

    public UnbalancedEntryException(BigDecimal totalDebit, BigDecimal totalCredit) {
        super(CODE, String.format("Journal entry is not balanced: debits=%s, credits=%s",
                totalDebit.toPlainString(), totalCredit.toPlainString()));
        this.totalDebit = totalDebit;
        this.totalCredit = totalCredit;
    }
}
