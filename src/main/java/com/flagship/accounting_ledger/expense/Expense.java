package com.flagship.accounting_ledger.expense;

import com.flagship.accounting_ledger.payment.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class Expense {
    UUID id;
    UUID companyId;
    String number;
    LocalDate expenseDate;
    String category;
    BigDecimal amount;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    PaymentMethod method;
    String description;
    String receipt;
    Instant createdAt;
    Instant updatedAt;
}
