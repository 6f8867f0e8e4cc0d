package com.flagship.accounting_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.BillableKind;
import com.flagship.accounting_ledger.document.DocumentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Invoice or bill as returned by the API. {@code status} is the effective
 * status (OVERDUE when applicable); {@code stored_status} is what the ledger
 * rules act on.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BillableDocumentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("supplier_id")
    UUID supplierId;

    @JsonProperty("number")
    String number;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    DocumentStatus status;

    @JsonProperty("stored_status")
    DocumentStatus storedStatus;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("balance_amount")
    BigDecimal balanceAmount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("terms_conditions")
    String termsConditions;

    @JsonProperty("items")
    List<LineItemResponse> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BillableDocumentResponse from(BillableDocument document, LocalDate today) {
        boolean invoice = document.getKind() == BillableKind.INVOICE;
        return BillableDocumentResponse.builder()
                .id(document.getId())
                .companyId(document.getCompanyId())
                .customerId(invoice ? document.getCounterpartyId() : null)
                .supplierId(invoice ? null : document.getCounterpartyId())
                .number(document.getNumber())
                .date(document.getDate())
                .dueDate(document.getDueDate())
                .status(document.effectiveStatus(today))
                .storedStatus(document.getStatus())
                .subtotal(document.getSubtotal())
                .taxAmount(document.getTaxAmount())
                .discountAmount(document.getDiscountAmount())
                .totalAmount(document.getTotalAmount())
                .paidAmount(document.getPaidAmount())
                .balanceAmount(document.getBalanceAmount())
                .notes(document.getNotes())
                .termsConditions(document.getTermsConditions())
                .items(document.getLines().stream().map(LineItemResponse::from).toList())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }
}
