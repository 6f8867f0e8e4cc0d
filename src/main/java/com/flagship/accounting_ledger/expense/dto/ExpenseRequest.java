package com.flagship.accounting_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.expense.ExpenseCommand;
import com.flagship.accounting_ledger.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Body of both POST and PUT. Required fields are checked by the service so
 * that PUT can stay partial.
 */
@Value
@Builder
@Jacksonized
public class ExpenseRequest {

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

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("description")
    String description;

    @JsonProperty("receipt")
    String receipt;

    public ExpenseCommand toCommand() {
        return ExpenseCommand.builder()
                .number(expenseNumber)
                .date(expenseDate)
                .category(category)
                .amount(amount)
                .taxAmount(taxAmount)
                .method(paymentMethod)
                .description(description)
                .receipt(receipt)
                .build();
    }
}
