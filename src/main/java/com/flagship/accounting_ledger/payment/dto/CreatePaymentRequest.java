package com.flagship.accounting_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.payment.PaymentMethod;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Exactly one of {@code invoice_id} and {@code bill_id} must be set; that rule
 * is enforced by the allocator so it reports INVALID_REFERENCE.
 */
@Value
@Builder
@Jacksonized
public class CreatePaymentRequest {

    @JsonProperty("payment_number")
    String paymentNumber;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("bill_id")
    UUID billId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;
}
