package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.event.JournalEntryPostedEvent;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.ledger.LedgerEffectApplier;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Posts journal entries and manages drafts.
 *
 * Posting persists the entry as POSTED, applies each line's signed effect to
 * its account and writes a JournalEntryPosted outbox event, all in one
 * transaction. Drafts go through the same validation but touch no balances
 * until they are posted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalEntryRepository entryRepository;
    private final AccountService accountService;
    private final JournalBalancer balancer;
    private final DocumentNumberingService numberingService;
    private final LedgerEffectApplier ledgerEffectApplier;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    public JournalEntry post(UUID companyId, JournalEntryCommand command) {
        return create(companyId, command, JournalStatus.POSTED);
    }

    public JournalEntry saveDraft(UUID companyId, JournalEntryCommand command) {
        return create(companyId, command, JournalStatus.DRAFT);
    }

    @Transactional
    public JournalEntry updateDraft(UUID companyId, UUID entryId, JournalEntryCommand command) {
        JournalEntryEntity entry = lock(companyId, entryId);
        entry.ensureDraft();

        if (command.getLines() != null) {
            BalancedEntry balanced = balancer.balance(command.getLines());
            accountService.requireTypes(companyId, accountIds(balanced));
            entry.replaceLines(balanced);
        }
        entry.updateDetails(command.getDate(), command.getDescription());

        JournalEntry saved = entryRepository.saveAndFlush(entry).toDomain();
        log.info("Journal draft updated: number={}, total={}", saved.getNumber(), saved.getTotalDebit());
        return saved;
    }

    /**
     * Re-validates the stored lines, then posts the draft.
     */
    @Transactional
    public JournalEntry postDraft(UUID companyId, UUID entryId) {
        JournalEntryEntity entry = lock(companyId, entryId);
        entry.ensureDraft();

        BalancedEntry balanced = balancer.balance(entry.lineCommands());
        applyAndPublish(companyId, entry, balanced);
        entry.markPosted();

        JournalEntry posted = entryRepository.saveAndFlush(entry).toDomain();
        recordPosted(posted);
        return posted;
    }

    @Transactional
    public void deleteDraft(UUID companyId, UUID entryId) {
        JournalEntryEntity entry = lock(companyId, entryId);
        entry.ensureDraft();
        entryRepository.delete(entry);
        log.info("Journal draft deleted: number={}", entry.getNumber());
    }

    @Transactional(readOnly = true)
    public JournalEntry get(UUID companyId, UUID entryId) {
        return entryRepository.findByIdAndCompanyId(entryId, companyId)
                .map(JournalEntryEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Journal entry", entryId));
    }

    @Transactional(readOnly = true)
    public Page<JournalEntry> list(UUID companyId, Pageable pageable) {
        return entryRepository.findAllByCompanyId(companyId, pageable).map(JournalEntryEntity::toDomain);
    }

    private JournalEntry create(UUID companyId, JournalEntryCommand command, JournalStatus status) {
        BalancedEntry balanced = balancer.balance(command.getLines());
        LocalDate date = command.getDate() != null ? command.getDate() : LocalDate.now(clock);

        JournalEntry entry = numberingService.insertWithNumber(companyId, DocumentType.JOURNAL_ENTRY,
                command.getNumber(), number -> {
                    JournalEntryEntity created = JournalEntryEntity.create(companyId, number, date,
                            command.getDescription(), status, balanced);
                    if (status == JournalStatus.POSTED) {
                        applyAndPublish(companyId, created, balanced);
                    } else {
                        accountService.requireTypes(companyId, accountIds(balanced));
                    }
                    return entryRepository.saveAndFlush(created).toDomain();
                });

        CorrelationContext.document(entry.getId());
        if (status == JournalStatus.POSTED) {
            recordPosted(entry);
        } else {
            log.info("Journal draft saved: number={}, total={}", entry.getNumber(), entry.getTotalDebit());
        }
        return entry;
    }

    private void applyAndPublish(UUID companyId, JournalEntryEntity entry, BalancedEntry balanced) {
        Map<UUID, AccountType> types = accountService.requireTypes(companyId, accountIds(balanced));
        ledgerEffectApplier.apply(companyId, balancer.effects(balanced, types));
        outboxService.saveEvent(JournalEntryPostedEvent.of(entry.getId(), companyId, entry.getNumber(),
                entry.getEntryDate(), balanced.getTotal(), balanced.getLines().size()));
    }

    private void recordPosted(JournalEntry entry) {
        ledgerMetrics.recordJournalEntryPosted();
        log.info("Journal entry posted: number={}, total={}, lines={}",
                entry.getNumber(), entry.getTotalDebit(), entry.getLines().size());
    }

    private JournalEntryEntity lock(UUID companyId, UUID entryId) {
        return entryRepository.findByIdAndCompanyIdForUpdate(entryId, companyId)
                .orElseThrow(() -> new NotFoundException("Journal entry", entryId));
    }

    private static Set<UUID> accountIds(BalancedEntry balanced) {
        Set<UUID> ids = new LinkedHashSet<>();
        balanced.getLines().forEach(line -> ids.add(line.getAccountId()));
        return ids;
    }
}
