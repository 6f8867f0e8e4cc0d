package com.flagship.accounting_ledger.invoice;

import com.flagship.accounting_ledger.document.LineItemEntity;
import com.flagship.accounting_ledger.document.PricedLine;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "invoice_items")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceItemEntity extends LineItemEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
    private InvoiceEntity invoice;

    InvoiceItemEntity(InvoiceEntity invoice, int position, PricedLine line) {
        super(position, line);
        this.invoice = invoice;
    }
}
