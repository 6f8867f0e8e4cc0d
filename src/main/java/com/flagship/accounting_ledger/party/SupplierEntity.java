package com.flagship.accounting_ledger.party;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(
    name = "suppliers",
    uniqueConstraints = @UniqueConstraint(name = "uq_suppliers_company_code", columnNames = {"company_id", "code"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SupplierEntity extends PartyEntity {

    private SupplierEntity(UUID companyId, String code, String name, String email, String phone,
                           int creditPeriodDays) {
        super(companyId, code, name, email, phone, creditPeriodDays);
    }

    static SupplierEntity create(UUID companyId, String code, String name, String email, String phone,
                                 int creditPeriodDays) {
        return new SupplierEntity(companyId, code, name, email, phone, creditPeriodDays);
    }

    @Override
    public PartyKind getKind() {
        return PartyKind.SUPPLIER;
    }
}
