package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.event.JournalEntryPostedEvent;
import com.flagship.accounting_ledger.event.LedgerEvent;
import com.flagship.accounting_ledger.exception.ImmutableStateException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.UnbalancedEntryException;
import com.flagship.accounting_ledger.ledger.BalanceTarget;
import com.flagship.accounting_ledger.ledger.LedgerEffectApplier;
import com.flagship.accounting_ledger.ledger.LedgerEffects;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JournalServiceTest {

    @Mock
    private JournalEntryRepository entryRepository;

    @Mock
    private AccountService accountService;

    @Mock
    private DocumentNumberingService numberingService;

    @Mock
    private LedgerEffectApplier ledgerEffectApplier;

    @Mock
    private OutboxService outboxService;

    private final JournalBalancer balancer = new JournalBalancer();
    private SimpleMeterRegistry meterRegistry;
    private JournalService journalService;

    private final UUID companyId = UUID.randomUUID();
    private final UUID rent = UUID.randomUUID();
    private final UUID cash = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-04-01T08:00:00Z"), ZoneOffset.UTC);
        journalService = new JournalService(entryRepository, accountService, balancer, numberingService,
                ledgerEffectApplier, outboxService, new LedgerMetrics(meterRegistry), clock);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<JournalLineCommand> rentPaidInCash(String debit, String credit) {
        return List.of(
                JournalLineCommand.builder().accountId(rent).description("April rent").debit(new BigDecimal(debit)).build(),
                JournalLineCommand.builder().accountId(cash).credit(new BigDecimal(credit)).build());
    }

    @SuppressWarnings("unchecked")
    private void stubNumbering() {
        when(numberingService.insertWithNumber(eq(companyId), eq(DocumentType.JOURNAL_ENTRY), isNull(), any()))
                .thenAnswer(invocation -> ((Function<String, Object>) invocation.getArgument(3)).apply("JE-000001"));
    }

    private void stubSave() {
        when(entryRepository.saveAndFlush(any(JournalEntryEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private void stubAccountTypes() {
        when(accountService.requireTypes(eq(companyId), anyCollection()))
                .thenReturn(Map.of(rent, AccountType.EXPENSE, cash, AccountType.ASSET));
    }

    private JournalEntryEntity entry(JournalStatus status) {
        JournalEntryEntity entry = JournalEntryEntity.create(companyId, "JE-000001", LocalDate.of(2026, 4, 1),
                "April rent", status, balancer.balance(rentPaidInCash("250", "250")));
        when(entryRepository.findByIdAndCompanyIdForUpdate(entry.getId(), companyId)).thenReturn(Optional.of(entry));
        return entry;
    }

    @Test
    @DisplayName("Posting applies each line's signed effect and writes an event")
    void testPostEntry() {
        printTestHeader("Post Journal Entry");
        stubNumbering();
        stubSave();
        stubAccountTypes();

        JournalEntry posted = journalService.post(companyId, JournalEntryCommand.builder()
                .description("April rent")
                .lines(rentPaidInCash("250", "250"))
                .build());

        System.out.println("Posted: " + posted.getNumber() + " total=" + posted.getTotalDebit());
        assertEquals("JE-000001", posted.getNumber());
        assertEquals(JournalStatus.POSTED, posted.getStatus());
        assertEquals(LocalDate.of(2026, 4, 1), posted.getEntryDate());
        assertEquals(2, posted.getLines().size());

        ArgumentCaptor<LedgerEffects> effects = ArgumentCaptor.forClass(LedgerEffects.class);
        verify(ledgerEffectApplier).apply(eq(companyId), effects.capture());
        assertEquals(0, new BigDecimal("250").compareTo(effects.getValue().deltaFor(BalanceTarget.ACCOUNT, rent)));
        assertEquals(0, new BigDecimal("-250").compareTo(effects.getValue().deltaFor(BalanceTarget.ACCOUNT, cash)));

        ArgumentCaptor<LedgerEvent> event = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(outboxService).saveEvent(event.capture());
        assertEquals(JournalEntryPostedEvent.EVENT_TYPE, event.getValue().getEventType());
        assertEquals(1.0, meterRegistry.counter("ledger.journal.posted").count());
        printSuccess("Expense up, cash down");
    }

    @Test
    @DisplayName("An unbalanced entry is rejected before a number is taken")
    void testUnbalancedEntry() {
        printTestHeader("Unbalanced Entry");

        assertThrows(UnbalancedEntryException.class, () -> journalService.post(companyId,
                JournalEntryCommand.builder().lines(rentPaidInCash("1000", "999")).build()));

        verify(numberingService, never()).insertWithNumber(any(), any(), any(), any());
        verify(ledgerEffectApplier, never()).apply(any(), any());
        verify(outboxService, never()).saveEvent(any());
    }

    @Test
    @DisplayName("Posting against an unknown account fails without touching balances")
    void testUnknownAccount() {
        printTestHeader("Unknown Account");
        stubNumbering();
        when(accountService.requireTypes(eq(companyId), anyCollection()))
                .thenThrow(new NotFoundException("Account", cash));

        assertThrows(NotFoundException.class, () -> journalService.post(companyId,
                JournalEntryCommand.builder().lines(rentPaidInCash("10", "10")).build()));

        verify(ledgerEffectApplier, never()).apply(any(), any());
        verify(entryRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("A draft is validated but touches no balances")
    void testSaveDraft() {
        printTestHeader("Save Draft");
        stubNumbering();
        stubSave();
        stubAccountTypes();

        JournalEntry draft = journalService.saveDraft(companyId, JournalEntryCommand.builder()
                .lines(rentPaidInCash("250", "250"))
                .build());

        assertEquals(JournalStatus.DRAFT, draft.getStatus());
        verify(ledgerEffectApplier, never()).apply(any(), any());
        verify(outboxService, never()).saveEvent(any());
        assertEquals(0.0, meterRegistry.counter("ledger.journal.posted").count());
    }

    @Test
    @DisplayName("Posting a draft applies its stored lines")
    void testPostDraft() {
        printTestHeader("Post Draft");
        JournalEntryEntity draft = entry(JournalStatus.DRAFT);
        stubSave();
        stubAccountTypes();

        JournalEntry posted = journalService.postDraft(companyId, draft.getId());

        assertEquals(JournalStatus.POSTED, posted.getStatus());
        ArgumentCaptor<LedgerEffects> effects = ArgumentCaptor.forClass(LedgerEffects.class);
        verify(ledgerEffectApplier).apply(eq(companyId), effects.capture());
        assertEquals(0, new BigDecimal("250").compareTo(effects.getValue().deltaFor(BalanceTarget.ACCOUNT, rent)));
        printSuccess("Draft posted");
    }

    @Test
    @DisplayName("Posted entries cannot be edited, posted again or deleted")
    void testPostedEntryIsImmutable() {
        printTestHeader("Posted Entry Is Immutable");
        JournalEntryEntity posted = entry(JournalStatus.POSTED);

        assertThrows(ImmutableStateException.class, () -> journalService.updateDraft(companyId, posted.getId(),
                JournalEntryCommand.builder().description("changed").build()));
        assertThrows(ImmutableStateException.class, () -> journalService.postDraft(companyId, posted.getId()));
        assertThrows(ImmutableStateException.class, () -> journalService.deleteDraft(companyId, posted.getId()));

        verify(entryRepository, never()).delete(any());
        verify(ledgerEffectApplier, never()).apply(any(), any());
    }

    @Test
    @DisplayName("Updating a draft replaces its lines after re-balancing")
    void testUpdateDraft() {
        printTestHeader("Update Draft");
        JournalEntryEntity draft = entry(JournalStatus.DRAFT);
        stubSave();
        stubAccountTypes();

        JournalEntry updated = journalService.updateDraft(companyId, draft.getId(), JournalEntryCommand.builder()
                .lines(rentPaidInCash("300", "300"))
                .build());

        assertEquals(0, new BigDecimal("300").compareTo(updated.getTotalDebit()));
        assertEquals(0, new BigDecimal("300").compareTo(updated.getTotalCredit()));
        assertEquals("April rent", updated.getDescription());

        assertThrows(UnbalancedEntryException.class, () -> journalService.updateDraft(companyId, draft.getId(),
                JournalEntryCommand.builder().lines(rentPaidInCash("300", "299")).build()));
    }

    @Test
    @DisplayName("Deleting a draft removes it")
    void testDeleteDraft() {
        printTestHeader("Delete Draft");
        JournalEntryEntity draft = entry(JournalStatus.DRAFT);

        journalService.deleteDraft(companyId, draft.getId());

        verify(entryRepository).delete(draft);
    }
}
