package com.flagship.accounting_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.expense.Expense;
import com.flagship.accounting_ledger.payment.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("expense_number")
    String expenseNumber;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("category")
    String category;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("description")
    String description;

    @JsonProperty("receipt")
    String receipt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ExpenseResponse from(Expense expense) {
        return new ExpenseResponse(expense.getId(), expense.getNumber(), expense.getExpenseDate(),
                expense.getCategory(), expense.getAmount(), expense.getTaxAmount(), expense.getTotalAmount(),
                expense.getMethod(), expense.getDescription(), expense.getReceipt(), expense.getCreatedAt());
    }
}
