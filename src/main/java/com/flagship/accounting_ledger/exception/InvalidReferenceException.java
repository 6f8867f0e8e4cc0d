package com.flagship.accounting_ledger.exception;

/**
 * A payment must name exactly one of invoice or bill.
 */
public class InvalidReferenceException extends LedgerException {

    public static final String CODE = "INVALID_REFERENCE";

    public InvalidReferenceException(String message) {
        super(CODE, message);
    }
}
