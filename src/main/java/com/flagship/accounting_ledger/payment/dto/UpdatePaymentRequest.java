package com.flagship.accounting_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class UpdatePaymentRequest {

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;
}
