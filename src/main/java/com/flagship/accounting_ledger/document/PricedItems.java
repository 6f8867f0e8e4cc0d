package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.totals.DocumentTotals;
import lombok.Value;

import java.util.List;

/**
 * Line items with product defaults applied, plus the document totals they produce.
 */
@Value
public class PricedItems {
    List<PricedLine> lines;
    DocumentTotals totals;
}
