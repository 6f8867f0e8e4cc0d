package com.flagship.accounting_ledger.exception;

/**
 * Missing required fields, malformed numbers or out-of-range values.
 */
public class ValidationException extends LedgerException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    protected ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
