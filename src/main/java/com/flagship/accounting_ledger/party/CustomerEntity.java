package com.flagship.accounting_ledger.party;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(
    name = "customers",
    uniqueConstraints = @UniqueConstraint(name = "uq_customers_company_code", columnNames = {"company_id", "code"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity extends PartyEntity {

    @Column(name = "credit_limit", precision = 19, scale = 4)
    private BigDecimal creditLimit;

    private CustomerEntity(UUID companyId, String code, String name, String email, String phone,
                           BigDecimal creditLimit, int creditPeriodDays) {
        super(companyId, code, name, email, phone, creditPeriodDays);
        this.creditLimit = creditLimit;
    }

    static CustomerEntity create(UUID companyId, String code, String name, String email, String phone,
                                 BigDecimal creditLimit, int creditPeriodDays) {
        return new CustomerEntity(companyId, code, name, email, phone, creditLimit, creditPeriodDays);
    }

    @Override
    public PartyKind getKind() {
        return PartyKind.CUSTOMER;
    }

    @Override
    public BigDecimal getCreditLimit() {
        return creditLimit;
    }
}
