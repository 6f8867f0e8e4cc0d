package com.flagship.accounting_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.document.BillableDocumentCommand;
import com.flagship.accounting_ledger.document.DocumentStatus;
import com.flagship.accounting_ledger.document.dto.LineItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateInvoiceRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    DocumentStatus status;

    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;

    @DecimalMin(value = "0", message = "Discount cannot be negative")
    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("terms_conditions")
    String termsConditions;

    public BillableDocumentCommand toCommand() {
        return BillableDocumentCommand.builder()
                .counterpartyId(customerId)
                .number(invoiceNumber)
                .date(date)
                .dueDate(dueDate)
                .status(status)
                .items(items == null ? null : items.stream().map(LineItemRequest::toCommand).toList())
                .discountAmount(discountAmount)
                .notes(notes)
                .termsConditions(termsConditions)
                .build();
    }
}
