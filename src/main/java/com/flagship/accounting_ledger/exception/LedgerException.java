package com.flagship.accounting_ledger.exception;

import lombok.Getter;

/**
 * Base class for all domain failures raised by the ledger core.
 *
 * Every subclass carries a stable error code that the REST layer
 * renders unchanged, so clients can branch on it without parsing messages.
 * All ledger failures are local to one operation and leave no partial state.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
