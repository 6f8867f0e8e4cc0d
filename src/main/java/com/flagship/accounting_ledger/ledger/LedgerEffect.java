package com.flagship.accounting_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A signed balance delta for one customer, supplier or account.
 */
@Value
public class LedgerEffect {
    BalanceTarget target;
    UUID targetId;
    BigDecimal delta;

    public static LedgerEffect customer(UUID customerId, BigDecimal delta) {
        return new LedgerEffect(BalanceTarget.CUSTOMER, customerId, delta);
    }

    public static LedgerEffect supplier(UUID supplierId, BigDecimal delta) {
        return new LedgerEffect(BalanceTarget.SUPPLIER, supplierId, delta);
    }

    public static LedgerEffect account(UUID accountId, BigDecimal delta) {
        return new LedgerEffect(BalanceTarget.ACCOUNT, accountId, delta);
    }
}
