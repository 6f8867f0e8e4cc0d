package com.flagship.accounting_ledger.expense;

import com.flagship.accounting_ledger.payment.PaymentMethod;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
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
 * Expense row. {@code totalAmount} is always {@code amount + taxAmount}.
 */
@Entity
@Table(
    name = "expenses",
    uniqueConstraints = @UniqueConstraint(name = "uq_expenses_company_number", columnNames = {"company_id", "number"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(nullable = false, updatable = false, length = 50)
    private String number;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 500)
    private String receipt;

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

    static ExpenseEntity create(UUID companyId, String number, LocalDate expenseDate, String category,
                                BigDecimal amount, BigDecimal taxAmount, PaymentMethod method,
                                String description, String receipt) {
        return new ExpenseEntity(UUID.randomUUID(), companyId, number, expenseDate, category,
                amount, taxAmount, amount.add(taxAmount), method, description, receipt, null, null);
    }

    void changeAmounts(BigDecimal amount, BigDecimal taxAmount) {
        this.amount = amount;
        this.taxAmount = taxAmount;
        this.totalAmount = amount.add(taxAmount);
    }

    void updateDetails(LocalDate expenseDate, String category, PaymentMethod method,
                       String description, String receipt) {
        if (expenseDate != null) {
            this.expenseDate = expenseDate;
        }
        if (category != null) {
            this.category = category;
        }
        if (method != null) {
            this.method = method;
        }
        if (description != null) {
            this.description = description;
        }
        if (receipt != null) {
            this.receipt = receipt;
        }
    }

    public Expense toDomain() {
        return new Expense(id, companyId, number, expenseDate, category, amount, taxAmount, totalAmount,
                method, description, receipt, createdAt, updatedAt);
    }
}
