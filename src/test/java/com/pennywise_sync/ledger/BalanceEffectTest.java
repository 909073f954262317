package com.pennywise_sync.ledger;

import com.pennywise_sync.model.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BalanceEffect")
class BalanceEffectTest {

    @Test
    @DisplayName("Income adds, expense subtracts, other types and deleted rows are neutral")
    void signedEffectByType() {
        BigDecimal amount = new BigDecimal("250.00");

        assertThat(BalanceEffect.of(Transaction.INCOME, amount, false)).isEqualByComparingTo("250");
        assertThat(BalanceEffect.of(Transaction.EXPENSE, amount, false)).isEqualByComparingTo("-250");
        assertThat(BalanceEffect.of("TRANSFER", amount, false)).isEqualByComparingTo("0");
        assertThat(BalanceEffect.of("INVESTMENT", amount, false)).isEqualByComparingTo("0");
        assertThat(BalanceEffect.of(Transaction.EXPENSE, amount, true)).isEqualByComparingTo("0");
        assertThat(BalanceEffect.of(Transaction.INCOME, null, false)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Reverse of an effect cancels it")
    void reverseCancels() {
        BigDecimal delta = BalanceEffect.of(Transaction.EXPENSE, new BigDecimal("42.10"), false);

        assertThat(delta.add(BalanceEffect.reverse(delta))).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Revising an amount on the same bucket yields one merged delta")
    void planMergesSameBucket() {
        SortedMap<Long, BigDecimal> deltas = BalanceEffect.plan(
                3L, new BigDecimal("-100"), 3L, new BigDecimal("-150"));

        assertThat(deltas).containsOnlyKeys(3L);
        assertThat(deltas.get(3L)).isEqualByComparingTo("-50");
    }

    @Test
    @DisplayName("Moving to another bucket reverses on the old one and applies on the new one")
    void planAcrossBuckets() {
        SortedMap<Long, BigDecimal> deltas = BalanceEffect.plan(
                7L, new BigDecimal("-100"), 2L, new BigDecimal("-100"));

        assertThat(deltas.firstKey()).isEqualTo(2L);
        assertThat(deltas.get(2L)).isEqualByComparingTo("-100");
        assertThat(deltas.get(7L)).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("An unchanged row produces no deltas")
    void planDropsZeroes() {
        assertThat(BalanceEffect.plan(4L, new BigDecimal("20.00"), 4L, new BigDecimal("20"))).isEmpty();
        assertThat(BalanceEffect.plan(null, null, null, null)).isEmpty();
    }

    @Test
    @DisplayName("Soft delete reverses whatever was applied")
    void planForDeletion() {
        SortedMap<Long, BigDecimal> deltas = BalanceEffect.plan(5L, new BigDecimal("2000"), null, null);

        assertThat(deltas.get(5L)).isEqualByComparingTo("-2000");
    }
}
