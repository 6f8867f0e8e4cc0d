package com.flagship.accounting_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.payment.Payment;
import com.flagship.accounting_ledger.payment.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("payment_number")
    String paymentNumber;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("bill_id")
    UUID billId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
            payment.getId(),
            payment.getCompanyId(),
            payment.getNumber(),
            payment.getDocumentRef().getInvoiceId(),
            payment.getDocumentRef().getBillId(),
            payment.getAmount(),
            payment.getPaymentDate(),
            payment.getMethod(),
            payment.getReferenceNumber(),
            payment.getNotes(),
            payment.getCreatedAt()
        );
    }
}
