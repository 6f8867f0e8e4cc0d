package com.flagship.accounting_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class ApplyPaymentCommand {
    DocumentRef documentRef;
    BigDecimal amount;
    PaymentMethod method;
    LocalDate date;
    String number;
    String referenceNumber;
    String notes;
    String idempotencyKey;
}
