package com.pennywise_sync.importer;

import com.pennywise_sync.model.RowAction;

/**
 * Result of merging one snapshot record.
 *
 * @param entity the row as it now stands in the store
 */
public record MergeOutcome<E>(RowAction action, E entity) {
}
