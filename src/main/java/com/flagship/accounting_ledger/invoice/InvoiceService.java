package com.flagship.accounting_ledger.invoice;

import com.flagship.accounting_ledger.document.AbstractBillableDocumentService;
import com.flagship.accounting_ledger.document.BillableDocumentCommand;
import com.flagship.accounting_ledger.document.BillableKind;
import com.flagship.accounting_ledger.document.DocumentStatus;
import com.flagship.accounting_ledger.document.LineItemPricer;
import com.flagship.accounting_ledger.ledger.LedgerEffectApplier;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import com.flagship.accounting_ledger.party.PartyKind;
import com.flagship.accounting_ledger.party.PartyService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Invoice lifecycle. Invoices move the customer's receivable balance.
 */
@Service
public class InvoiceService extends AbstractBillableDocumentService<InvoiceEntity> {

    private final InvoiceRepository invoiceRepository;
    private final PartyService partyService;

    public InvoiceService(InvoiceRepository invoiceRepository,
                          PartyService partyService,
                          DocumentNumberingService numberingService,
                          LineItemPricer lineItemPricer,
                          LedgerEffectApplier ledgerEffectApplier,
                          OutboxService outboxService,
                          LedgerMetrics ledgerMetrics,
                          Clock clock) {
        super(numberingService, lineItemPricer, ledgerEffectApplier, outboxService, ledgerMetrics, clock);
        this.invoiceRepository = invoiceRepository;
        this.partyService = partyService;
    }

    @Override
    protected BillableKind kind() {
        return BillableKind.INVOICE;
    }

    @Override
    protected void requireCounterparty(UUID companyId, UUID customerId) {
        partyService.requireExists(PartyKind.CUSTOMER, companyId, customerId);
    }

    @Override
    protected InvoiceEntity instantiate(UUID companyId, String number, BillableDocumentCommand command,
                                        LocalDate date, LocalDate dueDate, DocumentStatus status) {
        return InvoiceEntity.create(companyId, command.getCounterpartyId(), number, date, dueDate, status,
                command.getNotes(), command.getTermsConditions());
    }

    @Override
    protected void applyExtraDetails(InvoiceEntity invoice, BillableDocumentCommand command) {
        invoice.updateTerms(command.getTermsConditions());
    }

    @Override
    protected Optional<InvoiceEntity> find(UUID companyId, UUID id) {
        return invoiceRepository.findByIdAndCompanyId(id, companyId);
    }

    @Override
    protected Optional<InvoiceEntity> findForUpdate(UUID companyId, UUID id) {
        return invoiceRepository.findByIdAndCompanyIdForUpdate(id, companyId);
    }

    @Override
    protected Page<InvoiceEntity> findAll(UUID companyId, Pageable pageable) {
        return invoiceRepository.findAllByCompanyId(companyId, pageable);
    }

    @Override
    protected InvoiceEntity saveAndFlush(InvoiceEntity invoice) {
        return invoiceRepository.saveAndFlush(invoice);
    }

    @Override
    protected void remove(InvoiceEntity invoice) {
        invoiceRepository.delete(invoice);
    }
}
