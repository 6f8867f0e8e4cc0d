package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.totals.LineItemTotals;
import lombok.Value;

import java.util.UUID;

@Value
public class PricedLine {
    UUID productId;
    String description;
    LineItemTotals totals;
}
