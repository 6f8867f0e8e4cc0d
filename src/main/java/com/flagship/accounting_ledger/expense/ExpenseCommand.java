package com.flagship.accounting_ledger.expense;

import com.flagship.accounting_ledger.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Create or update input. On update every null field is left unchanged.
 */
@Value
@Builder
public class ExpenseCommand {
    String number;
    LocalDate date;
    String category;
    BigDecimal amount;
    BigDecimal taxAmount;
    PaymentMethod method;
    String description;
    String receipt;
}
