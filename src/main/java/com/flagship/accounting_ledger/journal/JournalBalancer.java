package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.UnbalancedEntryException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.ledger.LedgerEffect;
import com.flagship.accounting_ledger.ledger.LedgerEffects;
import com.flagship.accounting_ledger.totals.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Validates journal lines and turns them into account balance deltas.
 *
 * Rules, applied in order:
 * <ul>
 *   <li>at least one line</li>
 *   <li>each line has exactly one of debit and credit, and it is positive</li>
 *   <li>total debit equals total credit exactly, with no tolerance</li>
 * </ul>
 * No I/O; account existence is checked by the caller.
 */
@Component
public class JournalBalancer {

    public BalancedEntry balance(List<JournalLineCommand> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("Journal entry must have at least one line");
        }

        List<BalancedLine> balanced = new ArrayList<>(lines.size());
        BigDecimal totalDebit = Money.ZERO;
        BigDecimal totalCredit = Money.ZERO;

        for (int i = 0; i < lines.size(); i++) {
            BalancedLine line = balanceLine(i + 1, lines.get(i));
            balanced.add(line);
            totalDebit = totalDebit.add(line.getDebit());
            totalCredit = totalCredit.add(line.getCredit());
        }

        if (totalDebit.compareTo(totalCredit) != 0) {
            throw new UnbalancedEntryException(totalDebit, totalCredit);
        }
        return new BalancedEntry(List.copyOf(balanced), totalDebit);
    }

    /**
     * One signed delta per line, merged per account.
     *
     * @param accountTypes type of every account referenced by the entry
     */
    public LedgerEffects effects(BalancedEntry entry, Map<UUID, AccountType> accountTypes) {
        LedgerEffects effects = LedgerEffects.none();
        for (BalancedLine line : entry.getLines()) {
            AccountType type = accountTypes.get(line.getAccountId());
            if (type == null) {
                throw new NotFoundException("Account", line.getAccountId());
            }
            effects.add(LedgerEffect.account(line.getAccountId(), type.signedEffect(line.getDebit(), line.getCredit())));
        }
        return effects;
    }

    private BalancedLine balanceLine(int position, JournalLineCommand line) {
        if (line == null) {
            throw new ValidationException("Line " + position + " is missing");
        }
        if (line.getAccountId() == null) {
            throw new ValidationException("Line " + position + ": account is required");
        }
        BigDecimal debit = amount(position, "debit", line.getDebit());
        BigDecimal credit = amount(position, "credit", line.getCredit());
        if (debit.signum() > 0 == credit.signum() > 0) {
            throw new ValidationException("Line " + position + ": exactly one of debit or credit must be greater than 0");
        }
        return new BalancedLine(line.getAccountId(), line.getDescription(), debit, credit);
    }

    private static BigDecimal amount(int position, String side, BigDecimal value) {
        if (value == null) {
            return Money.ZERO;
        }
        if (value.signum() < 0) {
            throw new ValidationException("Line " + position + ": " + side + " cannot be negative");
        }
        if (value.stripTrailingZeros().scale() > Money.SCALE) {
            throw new ValidationException("Line " + position + ": " + side + " has more than "
                    + Money.SCALE + " decimal places");
        }
        return Money.normalize(value);
    }
}
