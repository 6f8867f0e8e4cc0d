package com.flagship.accounting_ledger.exception;

/**
 * Unexpected failure of the persistent store, kept apart from the domain
 * errors so callers can show a "try again later" message instead of a
 * validation message.
 */
public class StorageException extends LedgerException {

    public static final String CODE = "STORAGE_ERROR";

    public StorageException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
