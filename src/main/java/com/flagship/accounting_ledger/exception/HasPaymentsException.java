package com.flagship.accounting_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

public class HasPaymentsException extends LedgerException {

    public static final String CODE = "HAS_PAYMENTS";

    public HasPaymentsException(String documentKind, UUID documentId, BigDecimal paidAmount) {
        super(CODE, documentKind + " " + documentId + " has payments applied (paid " + paidAmount.toPlainString()
                + "); reverse the payments before deleting it");
    }
}
