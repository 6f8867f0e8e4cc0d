package com.flagship.accounting_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class Payment {
    UUID id;
    UUID companyId;
    String number;
    DocumentRef documentRef;
    BigDecimal amount;
    LocalDate paymentDate;
    PaymentMethod method;
    String referenceNumber;
    String notes;
    Instant createdAt;
    Instant updatedAt;
}
