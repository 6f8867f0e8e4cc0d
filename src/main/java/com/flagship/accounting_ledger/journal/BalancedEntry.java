package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class BalancedEntry {
    List<BalancedLine> lines;
    /** Sum of debits, which equals the sum of credits. */
    BigDecimal total;
}
