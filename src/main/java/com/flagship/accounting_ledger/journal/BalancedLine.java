package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Validated journal line: exactly one of debit and credit is positive, the
 * other is zero.
 */
@Value
public class BalancedLine {
    UUID accountId;
    String description;
    BigDecimal debit;
    BigDecimal credit;
}
