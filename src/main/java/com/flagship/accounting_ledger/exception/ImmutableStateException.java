package com.flagship.accounting_ledger.exception;

/**
 * Raised when mutating something that is frozen: a PAID document, a posted
 * journal entry, or master data already referenced by financial documents.
 */
public class ImmutableStateException extends LedgerException {

    public static final String CODE = "IMMUTABLE_STATE";

    public ImmutableStateException(String message) {
        super(CODE, message);
    }
}
