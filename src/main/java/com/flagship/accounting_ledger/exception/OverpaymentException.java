package com.flagship.accounting_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class OverpaymentException extends LedgerException {

    public static final String CODE = "OVERPAYMENT";

    private final BigDecimal amount;
    private final BigDecimal balance;

    public OverpaymentException(BigDecimal amount, BigDecimal balance) {
        super(CODE, "Amount " + amount.toPlainString() + " exceeds outstanding balance " + balance.toPlainString());
        this.amount = amount;
        this.balance = balance;
    }

    public OverpaymentException(String message, BigDecimal amount, BigDecimal balance) {
        super(CODE, message);
        this.amount = amount;
        this.balance = balance;
    }
}
