package com.flagship.accounting_ledger.exception;

public class EmptyDocumentException extends ValidationException {

    public static final String CODE = "EMPTY_DOCUMENT";

    public EmptyDocumentException(String documentKind) {
        super(CODE, documentKind + " must contain at least one line item");
    }
}
