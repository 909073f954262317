package com.pennywise_sync.ledger;

import com.pennywise_sync.model.Transaction;

import java.math.BigDecimal;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Signed bucket delta a transaction contributes while it is live.
 * INCOME adds its amount, EXPENSE subtracts it, anything else (and any deleted
 * transaction) contributes nothing.
 */
public final class BalanceEffect {

    private BalanceEffect() {
    }

    public static BigDecimal of(String type, BigDecimal amount, boolean deleted) {
        if (deleted || amount == null || type == null) {
            return BigDecimal.ZERO;
        }
        return switch (type) {
            case Transaction.INCOME -> amount;
            case Transaction.EXPENSE -> amount.negate();
            default -> BigDecimal.ZERO;
        };
    }

    public static BigDecimal of(Transaction tx) {
        return of(tx.getTransactionType(), tx.getAmount(), tx.deleted());
    }

    public static BigDecimal reverse(BigDecimal delta) {
        return delta.negate();
    }

    /**
     * Deltas that move a bucket from carrying {@code appliedAmount} (on {@code appliedBucket})
     * to carrying {@code newAmount} (on {@code newBucket}): the old effect reversed plus the
     * new one, merged when both land on the same bucket. Zero deltas are dropped; keys are
     * in ascending bucket order.
     */
    public static SortedMap<Long, BigDecimal> plan(Long appliedBucket, BigDecimal appliedAmount,
                                                   Long newBucket, BigDecimal newAmount) {
        SortedMap<Long, BigDecimal> deltas = new TreeMap<>();
        if (appliedBucket != null && appliedAmount != null) {
            deltas.merge(appliedBucket, reverse(appliedAmount), BigDecimal::add);
        }
        if (newBucket != null && newAmount != null) {
            deltas.merge(newBucket, newAmount, BigDecimal::add);
        }
        deltas.values().removeIf(delta -> delta.signum() == 0);
        return deltas;
    }
}
