package com.flagship.accounting_ledger.exception;

import java.util.UUID;

public class NotFoundException extends LedgerException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String entity, UUID id) {
        super(CODE, entity + " not found: " + id);
    }

    public NotFoundException(String message) {
        super(CODE, message);
    }
}
