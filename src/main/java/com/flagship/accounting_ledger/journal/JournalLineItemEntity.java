package com.flagship.accounting_ledger.journal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "journal_line_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalLineItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "journal_entry_id", nullable = false, updatable = false)
    private JournalEntryEntity entry;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(updatable = false)
    private String description;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal debit;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal credit;

    JournalLineItemEntity(JournalEntryEntity entry, int position, BalancedLine line) {
        this.id = UUID.randomUUID();
        this.entry = entry;
        this.position = position;
        this.accountId = line.getAccountId();
        this.description = line.getDescription();
        this.debit = line.getDebit();
        this.credit = line.getCredit();
    }

    JournalLine toDomain() {
        return new JournalLine(id, position, accountId, description, debit, credit);
    }
}
