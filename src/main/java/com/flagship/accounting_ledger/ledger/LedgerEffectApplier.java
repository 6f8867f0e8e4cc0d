package com.flagship.accounting_ledger.ledger;

import com.flagship.accounting_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Applies {@link LedgerEffects} to running balances.
 *
 * Must run inside the operation's transaction (MANDATORY propagation): the
 * balance deltas commit or roll back together with the document write that
 * produced them. Each delta is an atomic {@code balance = balance + ?} update,
 * so concurrent operations never lose an increment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEffectApplier {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public void apply(UUID companyId, LedgerEffects effects) {
        for (LedgerEffect effect : effects.merged()) {
            BalanceTarget target = effect.getTarget();
            int updated = jdbcTemplate.update(
                "UPDATE " + target.getTable()
                    + " SET balance = balance + ?, updated_at = CURRENT_TIMESTAMP"
                    + " WHERE id = ? AND company_id = ?",
                effect.getDelta(),
                effect.getTargetId(),
                companyId
            );
            if (updated == 0) {
                throw new NotFoundException(target.getLabel(), effect.getTargetId());
            }
            log.debug("Applied balance delta: target={}, id={}, delta={}",
                    target, effect.getTargetId(), effect.getDelta());
        }
    }
}
