package com.flagship.accounting_ledger.invoice;

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
    name = "invoices",
    uniqueConstraints = @UniqueConstraint(name = "uq_invoices_company_number", columnNames = {"company_id", "number"}),
    indexes = @Index(name = "idx_invoices_customer", columnList = "customer_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceEntity extends BillableDocumentEntity {

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @Column(name = "terms_conditions", columnDefinition = "TEXT")
    private String termsConditions;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<InvoiceItemEntity> items = new ArrayList<>();

    private InvoiceEntity(UUID companyId, UUID customerId, String number, LocalDate date, LocalDate dueDate,
                          DocumentStatus status, String notes, String termsConditions) {
        super(companyId, number, date, dueDate, status, notes);
        this.customerId = customerId;
        this.termsConditions = termsConditions;
    }

    static InvoiceEntity create(UUID companyId, UUID customerId, String number, LocalDate date,
                                LocalDate dueDate, DocumentStatus status, String notes, String termsConditions) {
        return new InvoiceEntity(companyId, customerId, number, date, dueDate, status, notes, termsConditions);
    }

    @Override
    public BillableKind getKind() {
        return BillableKind.INVOICE;
    }

    @Override
    public UUID getCounterpartyId() {
        return customerId;
    }

    @Override
    protected void reassignCounterparty(UUID counterpartyId) {
        this.customerId = counterpartyId;
    }

    @Override
    protected void replaceItems(List<PricedLine> lines) {
        items.clear();
        for (int i = 0; i < lines.size(); i++) {
            items.add(new InvoiceItemEntity(this, i + 1, lines.get(i)));
        }
    }

    void updateTerms(String termsConditions) {
        if (termsConditions != null) {
            this.termsConditions = termsConditions;
        }
    }
}
