package com.flagship.accounting_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A document number collided with an existing one, either because the caller
 * supplied a taken number or because generated numbers kept colliding until
 * the retry budget ran out.
 */
@Getter
public class DuplicateCodeException extends LedgerException {

    public static final String CODE = "DUPLICATE_CODE";

    private final UUID companyId;
    private final String number;

    public DuplicateCodeException(UUID companyId, String number) {
        super(CODE, "Number " + number + " already exists for company " + companyId);
        this.companyId = companyId;
        this.number = number;
    }

    public DuplicateCodeException(UUID companyId, String number, int attempts) {
        super(CODE, "Could not allocate a unique number for company " + companyId
                + " after " + attempts + " attempts (last tried " + number + ")");
        this.companyId = companyId;
        this.number = number;
    }
}
