package com.flagship.accounting_ledger.payment;

public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CREDIT_CARD,
    DEBIT_CARD,
    CHEQUE,
    UPI,
    OTHER
}
