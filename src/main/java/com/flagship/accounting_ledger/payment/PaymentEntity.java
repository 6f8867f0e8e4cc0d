package com.flagship.accounting_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Payment row.
 *
 * Document reference and amount are fixed at creation; correcting an amount
 * means deleting the payment (which reverses it) and applying a new one.
 * The idempotency key is a persistence concern and is not part of
 * {@link Payment}.
 */
@Entity
@Table(
    name = "payments",
    uniqueConstraints = @UniqueConstraint(name = "uq_payments_company_number", columnNames = {"company_id", "number"}),
    indexes = {
        @Index(name = "idx_payments_invoice", columnList = "invoice_id"),
        @Index(name = "idx_payments_bill", columnList = "bill_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(nullable = false, updatable = false, length = 50)
    private String number;

    @Column(name = "invoice_id", updatable = false)
    private UUID invoiceId;

    @Column(name = "bill_id", updatable = false)
    private UUID billId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Column(name = "reference_number", length = 100)
    private String referenceNumber;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentEntity create(UUID companyId, String number, DocumentRef ref, BigDecimal amount,
                                LocalDate paymentDate, PaymentMethod method, String referenceNumber,
                                String notes, String idempotencyKey) {
        return new PaymentEntity(
            UUID.randomUUID(),
            companyId,
            number,
            ref.getInvoiceId(),
            ref.getBillId(),
            amount,
            paymentDate,
            method,
            referenceNumber,
            notes,
            idempotencyKey,
            null, // set by @PrePersist
            null
        );
    }

    /**
     * Only descriptive fields can change.
     */
    void updateDetails(LocalDate paymentDate, PaymentMethod method, String referenceNumber, String notes) {
        if (paymentDate != null) {
            this.paymentDate = paymentDate;
        }
        if (method != null) {
            this.method = method;
        }
        if (referenceNumber != null) {
            this.referenceNumber = referenceNumber;
        }
        if (notes != null) {
            this.notes = notes;
        }
    }

    DocumentRef getDocumentRef() {
        return new DocumentRef(invoiceId, billId);
    }

    public Payment toDomain() {
        return new Payment(id, companyId, number, getDocumentRef(), amount, paymentDate, method,
                referenceNumber, notes, createdAt, updatedAt);
    }
}
