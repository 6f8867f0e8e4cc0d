package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.company.CompanyService;
import com.flagship.accounting_ledger.exception.ImmutableStateException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Chart of accounts. Balances are moved only by {@link JournalService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final JournalLineItemRepository lineItemRepository;
    private final CompanyService companyService;
    private final DocumentNumberingService numberingService;

    public Account create(UUID companyId, String code, String name, AccountType type, UUID parentId) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (type == null) {
            throw new ValidationException("Account type is required");
        }
        companyService.requireExists(companyId);
        if (parentId != null && !accountRepository.existsByIdAndCompanyId(parentId, companyId)) {
            throw new NotFoundException("Parent account", parentId);
        }

        Account account = numberingService.insertWithNumber(companyId, DocumentType.ACCOUNT, code,
                generated -> accountRepository.saveAndFlush(
                        AccountEntity.create(companyId, generated, name.trim(), type, parentId)).toDomain());

        log.info("Account created: companyId={}, code={}, type={}", companyId, account.getCode(), type);
        return account;
    }

    @Transactional(readOnly = true)
    public Account get(UUID companyId, UUID id) {
        return accountRepository.findByIdAndCompanyId(id, companyId)
                .map(AccountEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Account", id));
    }

    @Transactional(readOnly = true)
    public List<Account> list(UUID companyId) {
        return accountRepository.findAllByCompanyIdOrderByCodeAsc(companyId).stream()
                .map(AccountEntity::toDomain)
                .toList();
    }

    /**
     * Deletes an account no journal line and no sub-account refers to.
     */
    @Transactional
    public void delete(UUID companyId, UUID id) {
        AccountEntity account = accountRepository.findByIdAndCompanyId(id, companyId)
                .orElseThrow(() -> new NotFoundException("Account", id));
        if (lineItemRepository.existsByAccountId(id)) {
            throw new ImmutableStateException("Account " + account.getCode() + " is used by journal entries and cannot be deleted");
        }
        if (accountRepository.existsByCompanyIdAndParentId(companyId, id)) {
            throw new ImmutableStateException("Account " + account.getCode() + " has sub-accounts and cannot be deleted");
        }
        accountRepository.delete(account);
        log.info("Account deleted: companyId={}, code={}", companyId, account.getCode());
    }

    /**
     * Types of the given accounts; fails with {@link NotFoundException} for the
     * first id that does not belong to the company.
     */
    @Transactional(readOnly = true)
    public Map<UUID, AccountType> requireTypes(UUID companyId, Collection<UUID> accountIds) {
        Map<UUID, AccountType> types = accountRepository.findAllByCompanyIdAndIdIn(companyId, accountIds).stream()
                .collect(Collectors.toMap(AccountEntity::getId, AccountEntity::getType));
        for (UUID id : accountIds) {
            if (!types.containsKey(id)) {
                throw new NotFoundException("Account", id);
            }
        }
        return types;
    }
}
