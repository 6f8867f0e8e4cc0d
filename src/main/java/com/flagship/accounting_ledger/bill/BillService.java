package com.flagship.accounting_ledger.bill;

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
 * Bill lifecycle. Bills move the supplier's payable balance.
 */
@Service
public class BillService extends AbstractBillableDocumentService<BillEntity> {

    private final BillRepository billRepository;
    private final PartyService partyService;

    public BillService(BillRepository billRepository,
                       PartyService partyService,
                       DocumentNumberingService numberingService,
                       LineItemPricer lineItemPricer,
                       LedgerEffectApplier ledgerEffectApplier,
                       OutboxService outboxService,
                       LedgerMetrics ledgerMetrics,
                       Clock clock) {
        super(numberingService, lineItemPricer, ledgerEffectApplier, outboxService, ledgerMetrics, clock);
        this.billRepository = billRepository;
        this.partyService = partyService;
    }

    @Override
    protected BillableKind kind() {
        return BillableKind.BILL;
    }

    @Override
    protected void requireCounterparty(UUID companyId, UUID supplierId) {
        partyService.requireExists(PartyKind.SUPPLIER, companyId, supplierId);
    }

    @Override
    protected BillEntity instantiate(UUID companyId, String number, BillableDocumentCommand command,
                                     LocalDate date, LocalDate dueDate, DocumentStatus status) {
        return BillEntity.create(companyId, command.getCounterpartyId(), number, date, dueDate, status,
                command.getNotes());
    }

    @Override
    protected Optional<BillEntity> find(UUID companyId, UUID id) {
        return billRepository.findByIdAndCompanyId(id, companyId);
    }

    @Override
    protected Optional<BillEntity> findForUpdate(UUID companyId, UUID id) {
        return billRepository.findByIdAndCompanyIdForUpdate(id, companyId);
    }

    @Override
    protected Page<BillEntity> findAll(UUID companyId, Pageable pageable) {
        return billRepository.findAllByCompanyId(companyId, pageable);
    }

    @Override
    protected BillEntity saveAndFlush(BillEntity bill) {
        return billRepository.saveAndFlush(bill);
    }

    @Override
    protected void remove(BillEntity bill) {
        billRepository.delete(bill);
    }
}
