package com.pennywise_sync.importer;

import com.pennywise_sync.model.RowAction;

public record MergeSummary(String table, int added, int updated, int skipped, int deleted) {

    public static MergeSummary empty(String table) {
        return new MergeSummary(table, 0, 0, 0, 0);
    }

    public MergeSummary add(RowAction action) {
        return switch (action) {
            case ADDED -> new MergeSummary(table, added + 1, updated, skipped, deleted);
            case UPDATED -> new MergeSummary(table, added, updated + 1, skipped, deleted);
            case SKIPPED -> new MergeSummary(table, added, updated, skipped + 1, deleted);
            case DELETED -> new MergeSummary(table, added, updated, skipped, deleted + 1);
        };
    }

    @Override
    public String toString() {
        return table + ": " + added + " added, " + updated + " updated, " + skipped + " skipped, " + deleted + " deleted";
    }
}
