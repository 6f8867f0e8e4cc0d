package com.flagship.accounting_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.document.BillableDocumentCommand;
import com.flagship.accounting_ledger.document.DocumentStatus;
import com.flagship.accounting_ledger.document.dto.LineItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Partial update: absent fields are left as they are. When {@code items} is
 * present it replaces every existing item.
 */
@Value
@Builder
@Jacksonized
public class UpdateInvoiceRequest {

    @JsonProperty("customer_id")
    UUID customerId;

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
