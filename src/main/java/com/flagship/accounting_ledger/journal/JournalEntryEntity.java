package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.exception.ImmutableStateException;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Journal entry with its lines. A posted entry is final.
 */
@Entity
@Table(
    name = "journal_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_journal_entries_company_number", columnNames = {"company_id", "number"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(nullable = false, updatable = false, length = 50)
    private String number;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JournalStatus status;

    @Column(name = "total_debit", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalDebit;

    @Column(name = "total_credit", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalCredit;

    @OneToMany(mappedBy = "entry", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<JournalLineItemEntity> lines = new ArrayList<>();

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private JournalEntryEntity(UUID companyId, String number, LocalDate entryDate, String description,
                               JournalStatus status) {
        this.id = UUID.randomUUID();
        this.companyId = companyId;
        this.number = number;
        this.entryDate = entryDate;
        this.description = description;
        this.status = status;
    }

    static JournalEntryEntity create(UUID companyId, String number, LocalDate entryDate, String description,
                                     JournalStatus status, BalancedEntry balanced) {
        JournalEntryEntity entry = new JournalEntryEntity(companyId, number, entryDate, description, status);
        entry.replaceLines(balanced);
        return entry;
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

    void ensureDraft() {
        if (status == JournalStatus.POSTED) {
            throw new ImmutableStateException("Journal entry " + number + " is posted and cannot be changed");
        }
    }

    void replaceLines(BalancedEntry balanced) {
        lines.clear();
        List<BalancedLine> input = balanced.getLines();
        for (int i = 0; i < input.size(); i++) {
            lines.add(new JournalLineItemEntity(this, i + 1, input.get(i)));
        }
        this.totalDebit = balanced.getTotal();
        this.totalCredit = balanced.getTotal();
    }

    void updateDetails(LocalDate entryDate, String description) {
        if (entryDate != null) {
            this.entryDate = entryDate;
        }
        if (description != null) {
            this.description = description;
        }
    }

    void markPosted() {
        ensureDraft();
        this.status = JournalStatus.POSTED;
    }

    /**
     * Current lines in the shape the balancer produces, for re-validation on post.
     */
    List<JournalLineCommand> lineCommands() {
        return lines.stream()
                .map(line -> JournalLineCommand.builder()
                        .accountId(line.getAccountId())
                        .description(line.getDescription())
                        .debit(line.getDebit())
                        .credit(line.getCredit())
                        .build())
                .toList();
    }

    public JournalEntry toDomain() {
        return new JournalEntry(id, companyId, number, entryDate, description, status, totalDebit, totalCredit,
                lines.stream().map(JournalLineItemEntity::toDomain).toList(), createdAt, updatedAt);
    }
}
