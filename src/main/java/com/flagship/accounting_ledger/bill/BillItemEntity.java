package com.flagship.accounting_ledger.bill;

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
@Table(name = "bill_items")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BillItemEntity extends LineItemEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "bill_id", nullable = false, updatable = false)
    private BillEntity bill;

    BillItemEntity(BillEntity bill, int position, PricedLine line) {
        super(position, line);
        this.bill = bill;
    }
}
