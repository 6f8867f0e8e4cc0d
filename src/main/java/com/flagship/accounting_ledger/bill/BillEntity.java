package com.flagship.accounting_ledger.bill;

import com.flagship.accounting_ledger.document.BillableDocumentEntity;
import com.flagship.accounting_ledger.document.BillableKind;
import com.flagship.accounting_ledger.document.DocumentStatus;
import com.flagship.accounting_ledger.document.PricedLine;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
    name = "bills",
    uniqueConstraints = @UniqueConstraint(name = "uq_bills_company_number", columnNames = {"company_id", "number"}),
    indexes = @Index(name = "idx_bills_supplier", columnList = "supplier_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BillEntity extends BillableDocumentEntity {

    @Column(name = "supplier_id", nullable = false)
    private UUID supplierId;

    @OneToMany(mappedBy = "bill", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<BillItemEntity> items = new ArrayList<>();

    private BillEntity(UUID companyId, UUID supplierId, String number, LocalDate date, LocalDate dueDate,
                       DocumentStatus status, String notes) {
        super(companyId, number, date, dueDate, status, notes);
        this.supplierId = supplierId;
    }

    static BillEntity create(UUID companyId, UUID supplierId, String number, LocalDate date,
                             LocalDate dueDate, DocumentStatus status, String notes) {
        return new BillEntity(companyId, supplierId, number, date, dueDate, status, notes);
    }

    @Override
    public BillableKind getKind() {
        return BillableKind.BILL;
    }

    @Override
    public UUID getCounterpartyId() {
        return supplierId;
    }

    @Override
    protected void reassignCounterparty(UUID counterpartyId) {
        this.supplierId = counterpartyId;
    }

    @Override
    protected void replaceItems(List<PricedLine> lines) {
        items.clear();
        for (int i = 0; i < lines.size(); i++) {
            items.add(new BillItemEntity(this, i + 1, lines.get(i)));
        }
    }
}
