package com.pennywise_sync.importer;

import com.pennywise_sync.model.RowAction;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MergeSummaryTest {

    @Test
    void countsEachAction() {
        MergeSummary summary = MergeSummary.empty("cards")
                .add(RowAction.ADDED)
                .add(RowAction.ADDED)
                .add(RowAction.SKIPPED)
                .add(RowAction.UPDATED);

        assertThat(summary.added()).isEqualTo(2);
        assertThat(summary.updated()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.deleted()).isZero();
        assertThat(summary).hasToString("cards: 2 added, 1 updated, 1 skipped, 0 deleted");
    }
}
