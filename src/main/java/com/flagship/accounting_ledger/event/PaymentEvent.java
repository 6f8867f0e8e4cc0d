package com.flagship.accounting_ledger.event;

import com.flagship.accounting_ledger.document.BillableDocument;
import com.flagship.accounting_ledger.document.DocumentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * PaymentApplied or PaymentReversed, with the resulting document state.
 */
@Value
public class PaymentEvent implements LedgerEvent {

    public static final String APPLIED = "PaymentApplied";
    public static final String REVERSED = "PaymentReversed";
    public static final String AGGREGATE_TYPE = "Payment";

    UUID eventId;
    String eventType;
    UUID aggregateId;
    UUID companyId;
    String number;
    BigDecimal amount;
    String documentType;
    UUID documentId;
    BigDecimal documentPaidAmount;
    BigDecimal documentBalanceAmount;
    DocumentStatus documentStatus;
    Instant occurredAt;

    public static PaymentEvent of(String eventType, UUID paymentId, String number, BigDecimal amount,
                                  BillableDocument document) {
        return new PaymentEvent(
            UUID.randomUUID(),
            eventType,
            paymentId,
            document.getCompanyId(),
            number,
            amount,
            document.getKind().getLabel(),
            document.getId(),
            document.getPaidAmount(),
            document.getBalanceAmount(),
            document.getStatus(),
            Instant.now()
        );
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }
}
