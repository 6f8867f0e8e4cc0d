package com.flagship.accounting_ledger.expense;

import com.flagship.accounting_ledger.company.CompanyService;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.numbering.DocumentNumberingService;
import com.flagship.accounting_ledger.numbering.DocumentType;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.observability.LedgerMetrics;
import com.flagship.accounting_ledger.totals.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Expenses are standalone: they carry their own total and produce no
 * counterparty or account balance changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final CompanyService companyService;
    private final DocumentNumberingService numberingService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    public Expense create(UUID companyId, ExpenseCommand command) {
        if (command.getCategory() == null || command.getCategory().isBlank()) {
            throw new ValidationException("Expense category is required");
        }
        if (command.getMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
        BigDecimal amount = requireNonNegative("Amount", command.getAmount(), true);
        BigDecimal tax = requireNonNegative("Tax amount", command.getTaxAmount(), false);
        LocalDate date = command.getDate() != null ? command.getDate() : LocalDate.now(clock);
        companyService.requireExists(companyId);

        Expense expense = numberingService.insertWithNumber(companyId, DocumentType.EXPENSE, command.getNumber(),
                number -> expenseRepository.saveAndFlush(ExpenseEntity.create(companyId, number, date,
                        command.getCategory().trim(), amount, tax, command.getMethod(),
                        command.getDescription(), command.getReceipt())).toDomain());

        CorrelationContext.document(expense.getId());
        ledgerMetrics.recordDocumentCreated(DocumentType.EXPENSE.name());
        log.info("Expense created: number={}, category={}, total={}",
                expense.getNumber(), expense.getCategory(), expense.getTotalAmount());
        return expense;
    }

    /**
     * Number and company never change. The total is recomputed when either
     * amount or tax is supplied.
     */
    @Transactional
    public Expense update(UUID companyId, UUID id, ExpenseCommand command) {
        ExpenseEntity expense = expenseRepository.findByIdAndCompanyId(id, companyId)
                .orElseThrow(() -> new NotFoundException("Expense", id));

        if (command.getAmount() != null || command.getTaxAmount() != null) {
            BigDecimal amount = command.getAmount() != null
                    ? requireNonNegative("Amount", command.getAmount(), true)
                    : expense.getAmount();
            BigDecimal tax = command.getTaxAmount() != null
                    ? requireNonNegative("Tax amount", command.getTaxAmount(), false)
                    : expense.getTaxAmount();
            expense.changeAmounts(amount, tax);
        }
        if (command.getCategory() != null && command.getCategory().isBlank()) {
            throw new ValidationException("Expense category cannot be blank");
        }
        expense.updateDetails(command.getDate(),
                command.getCategory() != null ? command.getCategory().trim() : null,
                command.getMethod(), command.getDescription(), command.getReceipt());

        Expense saved = expenseRepository.saveAndFlush(expense).toDomain();
        log.info("Expense updated: number={}, total={}", saved.getNumber(), saved.getTotalAmount());
        return saved;
    }

    @Transactional
    public void delete(UUID companyId, UUID id) {
        ExpenseEntity expense = expenseRepository.findByIdAndCompanyId(id, companyId)
                .orElseThrow(() -> new NotFoundException("Expense", id));
        expenseRepository.delete(expense);
        ledgerMetrics.recordDocumentDeleted(DocumentType.EXPENSE.name());
        log.info("Expense deleted: number={}", expense.getNumber());
    }

    @Transactional(readOnly = true)
    public Expense get(UUID companyId, UUID id) {
        return expenseRepository.findByIdAndCompanyId(id, companyId)
                .map(ExpenseEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Expense", id));
    }

    @Transactional(readOnly = true)
    public Page<Expense> list(UUID companyId, Pageable pageable) {
        return expenseRepository.findAllByCompanyId(companyId, pageable).map(ExpenseEntity::toDomain);
    }

    private static BigDecimal requireNonNegative(String field, BigDecimal value, boolean required) {
        if (value == null) {
            if (required) {
                throw new ValidationException(field + " is required");
            }
            return Money.ZERO;
        }
        if (value.signum() < 0) {
            throw new ValidationException(field + " cannot be negative");
        }
        return Money.normalize(value);
    }
}
