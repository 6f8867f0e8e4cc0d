package com.flagship.accounting_ledger.party;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Columns shared by customers and suppliers.
 *
 * {@code balance} is the net amount owed. It is inserted as zero and then only
 * moved by atomic SQL increments (see LedgerEffectApplier), so the JPA mapping
 * never writes it back.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class PartyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(nullable = false, updatable = false, length = 50)
    private String code;

    @Column(nullable = false)
    private String name;

    private String email;

    @Column(length = 30)
    private String phone;

    @Column(name = "credit_period_days", nullable = false)
    private int creditPeriodDays;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PartyEntity(UUID companyId, String code, String name, String email, String phone,
                          int creditPeriodDays) {
        this.id = UUID.randomUUID();
        this.companyId = companyId;
        this.code = code;
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.creditPeriodDays = creditPeriodDays;
        this.balance = BigDecimal.ZERO;
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

    public abstract PartyKind getKind();

    public BigDecimal getCreditLimit() {
        return null;
    }

    public Party toDomain() {
        return new Party(getKind(), id, companyId, code, name, email, phone, getCreditLimit(),
                creditPeriodDays, balance);
    }
}
