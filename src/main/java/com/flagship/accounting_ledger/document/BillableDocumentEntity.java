package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.exception.ImmutableStateException;
import com.flagship.accounting_ledger.exception.OverpaymentException;
import com.flagship.accounting_ledger.totals.DocumentTotals;
import com.flagship.accounting_ledger.totals.Money;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * State and rules shared by invoices and bills.
 *
 * No setters: monetary fields change only through {@link #applyTotals},
 * {@link #applyPayment} and {@link #reversePayment}, each of which keeps
 * {@code balanceAmount == totalAmount - paidAmount} and re-derives the status.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class BillableDocumentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(nullable = false, updatable = false, length = 50)
    private String number;

    @Column(name = "document_date", nullable = false)
    private LocalDate date;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentStatus status;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal taxAmount;

    @Column(name = "discount_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal discountAmount;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal paidAmount;

    @Column(name = "balance_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal balanceAmount;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BillableDocumentEntity(UUID companyId, String number, LocalDate date, LocalDate dueDate,
                                     DocumentStatus status, String notes) {
        this.id = UUID.randomUUID();
        this.companyId = companyId;
        this.number = number;
        this.date = date;
        this.dueDate = dueDate;
        this.status = status;
        this.notes = notes;
        this.subtotal = Money.ZERO;
        this.taxAmount = Money.ZERO;
        this.discountAmount = Money.ZERO;
        this.totalAmount = Money.ZERO;
        this.paidAmount = Money.ZERO;
        this.balanceAmount = Money.ZERO;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public abstract BillableKind getKind();

    public abstract UUID getCounterpartyId();

    protected abstract void reassignCounterparty(UUID counterpartyId);

    protected abstract void replaceItems(List<PricedLine> lines);

    public abstract List<? extends LineItemEntity> getItems();

    /**
     * Replaces all items and totals. The new total may not fall below what has
     * already been paid.
     */
    public void applyItems(PricedItems priced) {
        DocumentTotals totals = priced.getTotals();
        if (totals.getTotalAmount().compareTo(paidAmount) < 0) {
            throw new OverpaymentException(
                    getKind().getLabel() + " total " + totals.getTotalAmount().toPlainString()
                            + " would be below the amount already paid " + paidAmount.toPlainString(),
                    paidAmount, totals.getTotalAmount());
        }
        replaceItems(priced.getLines());
        this.subtotal = totals.getSubtotal();
        this.taxAmount = totals.getTaxAmount();
        this.discountAmount = totals.getDiscountAmount();
        this.totalAmount = totals.getTotalAmount();
        this.balanceAmount = totalAmount.subtract(paidAmount);
        this.status = DocumentStatusRules.derive(getKind(), status, paidAmount, totalAmount);
    }

    public void applyPayment(BigDecimal amount) {
        if (amount.compareTo(balanceAmount) > 0) {
            throw new OverpaymentException(amount, balanceAmount);
        }
        this.paidAmount = paidAmount.add(amount);
        this.balanceAmount = totalAmount.subtract(paidAmount);
        this.status = DocumentStatusRules.derive(getKind(), status, paidAmount, totalAmount);
    }

    public void reversePayment(BigDecimal amount) {
        if (amount.compareTo(paidAmount) > 0) {
            throw new IllegalStateException("Reversal of " + amount.toPlainString() + " exceeds paid amount "
                    + paidAmount.toPlainString() + " on " + getKind().getLabel() + " " + id);
        }
        this.paidAmount = paidAmount.subtract(amount);
        this.balanceAmount = totalAmount.subtract(paidAmount);
        this.status = DocumentStatusRules.derive(getKind(), status, paidAmount, totalAmount);
    }

    public void requestStatus(DocumentStatus requested) {
        this.status = DocumentStatusRules.resolve(getKind(), status, requested, paidAmount, totalAmount);
    }

    public void updateDetails(LocalDate date, LocalDate dueDate, String notes) {
        if (date != null) {
            this.date = date;
        }
        if (dueDate != null) {
            this.dueDate = dueDate;
        }
        if (notes != null) {
            this.notes = notes;
        }
    }

    /**
     * PAID documents are frozen.
     */
    public void ensureMutable() {
        if (status == DocumentStatus.PAID) {
            throw new ImmutableStateException(getKind().getLabel() + " " + number + " is fully paid and cannot be modified");
        }
    }

    public boolean hasPayments() {
        return paidAmount.signum() > 0;
    }

    protected String getTermsConditions() {
        return null;
    }

    public BillableDocument toDomain() {
        return new BillableDocument(
            getKind(),
            id,
            companyId,
            getCounterpartyId(),
            number,
            date,
            dueDate,
            status,
            subtotal,
            taxAmount,
            discountAmount,
            totalAmount,
            paidAmount,
            balanceAmount,
            notes,
            getTermsConditions(),
            getItems().stream().map(LineItemEntity::toDomain).toList(),
            createdAt,
            updatedAt
        );
    }
}
