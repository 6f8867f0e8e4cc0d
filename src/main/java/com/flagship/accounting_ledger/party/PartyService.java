package com.flagship.accounting_ledger.party;

import com.flagship.accounting_ledger.bill.BillRepository;
import com.flagship.accounting_ledger.company.CompanyService;
import com.flagship.accounting_ledger.exception.ImmutableStateException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.invoice.InvoiceRepository;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.party.dto.CreatePartyRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Customers and suppliers. Balances start at zero and are moved only by
 * invoices, bills and payments.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PartyService {

    private static final int DEFAULT_CREDIT_PERIOD_DAYS = 30;

    private final CustomerRepository customerRepository;
    private final SupplierRepository supplierRepository;
    private final InvoiceRepository invoiceRepository;
    private final BillRepository billRepository;
    private final CompanyService companyService;
    private final DocumentNumberingService numberingService;

    public Party createCustomer(UUID companyId, CreatePartyRequest request) {
        validate(request);
        companyService.requireExists(companyId);
        int creditPeriod = creditPeriod(request);

        Party customer = numberingService.insertWithNumber(companyId, DocumentType.CUSTOMER, request.getCode(),
                code -> customerRepository.saveAndFlush(CustomerEntity.create(companyId, code,
                        request.getName().trim(), request.getEmail(), request.getPhone(),
                        request.getCreditLimit(), creditPeriod)).toDomain());

        log.info("Customer created: companyId={}, code={}", companyId, customer.getCode());
        return customer;
    }

    public Party createSupplier(UUID companyId, CreatePartyRequest request) {
        validate(request);
        companyService.requireExists(companyId);
        int creditPeriod = creditPeriod(request);

        Party supplier = numberingService.insertWithNumber(companyId, DocumentType.SUPPLIER, request.getCode(),
                code -> supplierRepository.saveAndFlush(SupplierEntity.create(companyId, code,
                        request.getName().trim(), request.getEmail(), request.getPhone(),
                        creditPeriod)).toDomain());

        log.info("Supplier created: companyId={}, code={}", companyId, supplier.getCode());
        return supplier;
    }

    @Transactional(readOnly = true)
    public Party get(PartyKind kind, UUID companyId, UUID id) {
        PartyEntity entity = kind == PartyKind.CUSTOMER
                ? customerRepository.findByIdAndCompanyId(id, companyId).orElse(null)
                : supplierRepository.findByIdAndCompanyId(id, companyId).orElse(null);
        if (entity == null) {
            throw new NotFoundException(kind.getLabel(), id);
        }
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Party> list(PartyKind kind, UUID companyId) {
        List<? extends PartyEntity> entities = kind == PartyKind.CUSTOMER
                ? customerRepository.findAllByCompanyIdOrderByCodeAsc(companyId)
                : supplierRepository.findAllByCompanyIdOrderByCodeAsc(companyId);
        return entities.stream().map(PartyEntity::toDomain).toList();
    }

    /**
     * Deletes a counterparty that no invoice or bill refers to.
     */
    @Transactional
    public void delete(PartyKind kind, UUID companyId, UUID id) {
        if (kind == PartyKind.CUSTOMER) {
            CustomerEntity customer = customerRepository.findByIdAndCompanyId(id, companyId)
                    .orElseThrow(() -> new NotFoundException(kind.getLabel(), id));
            if (invoiceRepository.existsByCompanyIdAndCustomerId(companyId, id)) {
                throw new ImmutableStateException("Customer " + customer.getCode() + " has invoices and cannot be deleted");
            }
            customerRepository.delete(customer);
        } else {
            SupplierEntity supplier = supplierRepository.findByIdAndCompanyId(id, companyId)
                    .orElseThrow(() -> new NotFoundException(kind.getLabel(), id));
            if (billRepository.existsByCompanyIdAndSupplierId(companyId, id)) {
                throw new ImmutableStateException("Supplier " + supplier.getCode() + " has bills and cannot be deleted");
            }
            supplierRepository.delete(supplier);
        }
        log.info("{} deleted: companyId={}, id={}", kind.getLabel(), companyId, id);
    }

    /**
     * Fails with {@link NotFoundException} unless the counterparty exists in the company.
     */
    @Transactional(readOnly = true)
    public void requireExists(PartyKind kind, UUID companyId, UUID id) {
        boolean exists = id != null && (kind == PartyKind.CUSTOMER
                ? customerRepository.existsByIdAndCompanyId(id, companyId)
                : supplierRepository.existsByIdAndCompanyId(id, companyId));
        if (!exists) {
            throw new NotFoundException(kind.getLabel(), id);
        }
    }

    private void validate(CreatePartyRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Name is required");
        }
        if (request.getCreditLimit() != null && request.getCreditLimit().signum() < 0) {
            throw new ValidationException("Credit limit cannot be negative");
        }
    }

    private int creditPeriod(CreatePartyRequest request) {
        Integer days = request.getCreditPeriodDays();
        if (days == null) {
            return DEFAULT_CREDIT_PERIOD_DAYS;
        }
        if (days < 0) {
            throw new ValidationException("Credit period cannot be negative");
        }
        return days;
    }
}
