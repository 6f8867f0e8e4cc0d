package com.flagship.accounting_ledger.ledger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Declarative set of balance deltas produced by one ledger operation.
 *
 * Operations describe what should happen to balances; {@link LedgerEffectApplier}
 * applies the set inside the operation's transaction. Deltas on the same target
 * are merged, zero results are dropped, and {@link #merged()} returns them in a
 * fixed order (target kind, then id) so concurrent operations lock rows in the
 * same sequence.
 */
public final class LedgerEffects {

    private static final Comparator<LedgerEffect> LOCK_ORDER =
            Comparator.comparing(LedgerEffect::getTarget)
                      .thenComparing(LedgerEffect::getTargetId);

    private final Map<Key, BigDecimal> deltas = new LinkedHashMap<>();

    public static LedgerEffects none() {
        return new LedgerEffects();
    }

    public static LedgerEffects of(LedgerEffect... effects) {
        LedgerEffects result = new LedgerEffects();
        for (LedgerEffect effect : effects) {
            result.add(effect);
        }
        return result;
    }

    public LedgerEffects add(LedgerEffect effect) {
        Objects.requireNonNull(effect.getTargetId(), "targetId");
        Objects.requireNonNull(effect.getDelta(), "delta");
        deltas.merge(new Key(effect.getTarget(), effect.getTargetId()), effect.getDelta(), BigDecimal::add);
        return this;
    }

    public LedgerEffects addAll(LedgerEffects other) {
        other.merged().forEach(this::add);
        return this;
    }

    public List<LedgerEffect> merged() {
        List<LedgerEffect> result = new ArrayList<>();
        deltas.forEach((key, delta) -> {
            if (delta.signum() != 0) {
                result.add(new LedgerEffect(key.target(), key.id(), delta));
            }
        });
        result.sort(LOCK_ORDER);
        return Collections.unmodifiableList(result);
    }

    public BigDecimal deltaFor(BalanceTarget target, UUID id) {
        return deltas.getOrDefault(new Key(target, id), BigDecimal.ZERO);
    }

    public boolean isEmpty() {
        return merged().isEmpty();
    }

    @Override
    public String toString() {
        return "LedgerEffects" + merged();
    }

    private record Key(BalanceTarget target, UUID id) {
    }
}
