package com.flagship.accounting_ledger.document;

import com.flagship.accounting_ledger.event.DocumentChangedEvent;
import com.flagship.accounting_ledger.exception.HasPaymentsException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.ledger.LedgerEffectApplier;
import com.flagship.accounting_ledger.ledger.LedgerEffects;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Create, update and delete of invoices and bills.
 *
 * Every mutation computes its counterparty balance delta as
 * {@link LedgerEffects} and applies it in the same transaction as the document
 * write and the outbox event:
 * <ul>
 *   <li>create: counterparty +total</li>
 *   <li>update: counterparty +(newBalance - oldBalance); on reassignment the old
 *       party loses its old balance and the new party gains the new one</li>
 *   <li>delete: counterparty -balance (only when nothing has been paid)</li>
 * </ul>
 *
 * @param <E> invoice or bill entity
 */
@Slf4j
public abstract class AbstractBillableDocumentService<E extends BillableDocumentEntity> {

    private final DocumentNumberingService numberingService;
    private final LineItemPricer lineItemPricer;
    private final LedgerEffectApplier ledgerEffectApplier;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Value("${ledger.documents.default-due-days:30}")
    private int defaultDueDays = 30;

    protected AbstractBillableDocumentService(DocumentNumberingService numberingService,
                                              LineItemPricer lineItemPricer,
                                              LedgerEffectApplier ledgerEffectApplier,
                                              OutboxService outboxService,
                                              LedgerMetrics ledgerMetrics,
                                              Clock clock) {
        this.numberingService = numberingService;
        this.lineItemPricer = lineItemPricer;
        this.ledgerEffectApplier = ledgerEffectApplier;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
    }

    protected abstract BillableKind kind();

    protected abstract void requireCounterparty(UUID companyId, UUID counterpartyId);

    protected abstract E instantiate(UUID companyId, String number, BillableDocumentCommand command,
                                     LocalDate date, LocalDate dueDate, DocumentStatus status);

    protected abstract Optional<E> find(UUID companyId, UUID id);

    protected abstract Optional<E> findForUpdate(UUID companyId, UUID id);

    protected abstract Page<E> findAll(UUID companyId, Pageable pageable);

    protected abstract E saveAndFlush(E document);

    protected abstract void remove(E document);

    /**
     * Hook for fields only one document kind has.
     */
    protected void applyExtraDetails(E document, BillableDocumentCommand command) {
    }

    public BillableDocument create(UUID companyId, BillableDocumentCommand command) {
        BillableKind kind = kind();
        if (command.getCounterpartyId() == null) {
            throw new ValidationException(kind.getCounterpartyLabel() + " is required");
        }
        LocalDate date = command.getDate() != null ? command.getDate() : LocalDate.now(clock);
        LocalDate dueDate = command.getDueDate() != null ? command.getDueDate() : date.plusDays(defaultDueDays);
        if (dueDate.isBefore(date)) {
            throw new ValidationException("Due date cannot be before the document date");
        }
        DocumentStatus status = DocumentStatusRules.initial(kind, command.getStatus());
        PricedItems priced = lineItemPricer.price(kind, companyId, command.getItems(), command.getDiscountAmount());

        BillableDocument created = numberingService.insertWithNumber(companyId, kind.getDocumentType(),
                command.getNumber(), number -> {
                    requireCounterparty(companyId, command.getCounterpartyId());

                    E document = instantiate(companyId, number, command, date, dueDate, status);
                    document.applyItems(priced);
                    E saved = saveAndFlush(document);

                    ledgerEffectApplier.apply(companyId, LedgerEffects.of(
                            kind.counterpartyEffect(saved.getCounterpartyId(), saved.getTotalAmount())));

                    BillableDocument result = saved.toDomain();
                    outboxService.saveEvent(DocumentChangedEvent.of(DocumentChangedEvent.Change.CREATED, result));
                    return result;
                });

        CorrelationContext.document(created.getId());
        ledgerMetrics.recordDocumentCreated(kind.name());
        log.info("{} created: number={}, total={}, status={}",
                kind.getLabel(), created.getNumber(), created.getTotalAmount(), created.getStatus());
        return created;
    }

    @Transactional
    public BillableDocument update(UUID companyId, UUID id, BillableDocumentCommand command) {
        BillableKind kind = kind();
        E document = findForUpdate(companyId, id)
                .orElseThrow(() -> new NotFoundException(kind.getLabel(), id));
        document.ensureMutable();

        UUID oldParty = document.getCounterpartyId();
        BigDecimal oldBalance = document.getBalanceAmount();

        if (command.getCounterpartyId() != null && !command.getCounterpartyId().equals(oldParty)) {
            requireCounterparty(companyId, command.getCounterpartyId());
            document.reassignCounterparty(command.getCounterpartyId());
        }

        if (command.getItems() != null) {
            document.applyItems(lineItemPricer.price(kind, companyId, command.getItems(), command.getDiscountAmount()));
        } else if (command.getDiscountAmount() != null) {
            throw new ValidationException("Document discount can only be changed together with the items");
        }

        document.updateDetails(command.getDate(), command.getDueDate(), command.getNotes());
        if (document.getDueDate().isBefore(document.getDate())) {
            throw new ValidationException("Due date cannot be before the document date");
        }
        applyExtraDetails(document, command);
        document.requestStatus(command.getStatus());

        E saved = saveAndFlush(document);

        LedgerEffects effects = LedgerEffects.of(
                kind.counterpartyEffect(oldParty, oldBalance.negate()),
                kind.counterpartyEffect(saved.getCounterpartyId(), saved.getBalanceAmount()));
        ledgerEffectApplier.apply(companyId, effects);

        BillableDocument result = saved.toDomain();
        outboxService.saveEvent(DocumentChangedEvent.of(DocumentChangedEvent.Change.UPDATED, result));

        log.info("{} updated: number={}, total={}, balance={}, effects={}",
                kind.getLabel(), result.getNumber(), result.getTotalAmount(), result.getBalanceAmount(), effects);
        return result;
    }

    @Transactional
    public void delete(UUID companyId, UUID id) {
        BillableKind kind = kind();
        E document = findForUpdate(companyId, id)
                .orElseThrow(() -> new NotFoundException(kind.getLabel(), id));
        if (document.hasPayments()) {
            throw new HasPaymentsException(kind.getLabel(), id, document.getPaidAmount());
        }

        BillableDocument snapshot = document.toDomain();
        ledgerEffectApplier.apply(companyId, LedgerEffects.of(
                kind.counterpartyEffect(document.getCounterpartyId(), document.getBalanceAmount().negate())));
        remove(document);
        outboxService.saveEvent(DocumentChangedEvent.of(DocumentChangedEvent.Change.DELETED, snapshot));

        ledgerMetrics.recordDocumentDeleted(kind.name());
        log.info("{} deleted: number={}, balance released={}",
                kind.getLabel(), snapshot.getNumber(), snapshot.getBalanceAmount());
    }

    @Transactional(readOnly = true)
    public BillableDocument get(UUID companyId, UUID id) {
        return find(companyId, id)
                .map(BillableDocumentEntity::toDomain)
                .orElseThrow(() -> new NotFoundException(kind().getLabel(), id));
    }

    @Transactional(readOnly = true)
    public Page<BillableDocument> list(UUID companyId, Pageable pageable) {
        return findAll(companyId, pageable).map(BillableDocumentEntity::toDomain);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
