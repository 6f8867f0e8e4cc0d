package com.flagship.accounting_ledger.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Tenant. Every other record is scoped by its id. Companies are never
 * updated or deleted once created.
 */
@Entity
@Table(name = "companies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CompanyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(updatable = false)
    private String email;

    @Column(name = "base_currency", nullable = false, updatable = false, length = 3)
    private String baseCurrency;

    @Column(name = "tax_id", updatable = false, length = 50)
    private String taxId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CompanyEntity create(String name, String email, String baseCurrency, String taxId) {
        return new CompanyEntity(UUID.randomUUID(), name, email, baseCurrency, taxId, null);
    }
}
