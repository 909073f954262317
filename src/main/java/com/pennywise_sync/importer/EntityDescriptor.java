package com.pennywise_sync.importer;

import java.util.List;
import java.util.Set;

/**
 * How one snapshot collection maps onto a table.
 *
 * @param type              mapped entity class
 * @param table             table name, recorded on every row log
 * @param naturalKey        properties whose values identify a stored row
 * @param idProperty        primary key property
 * @param assignedId        true when the device id is the primary key; otherwise an incoming id is ignored
 * @param managedProperties properties owned by this service that a snapshot never overwrites
 */
public record EntityDescriptor<E>(
        Class<E> type,
        String table,
        List<String> naturalKey,
        String idProperty,
        boolean assignedId,
        Set<String> managedProperties
) {

    public static <E> EntityDescriptor<E> generatedId(Class<E> type, String table, String... naturalKey) {
        return new EntityDescriptor<>(type, table, List.of(naturalKey), "id", false, Set.of());
    }

    public static <E> EntityDescriptor<E> assignedId(Class<E> type, String table, String idProperty) {
        return new EntityDescriptor<>(type, table, List.of(idProperty), idProperty, true, Set.of());
    }

    public EntityDescriptor<E> managing(String... properties) {
        return new EntityDescriptor<>(type, table, naturalKey, idProperty, assignedId, Set.of(properties));
    }

    public boolean isMergeable(String property) {
        if (managedProperties.contains(property)) return false;
        return assignedId || !property.equals(idProperty);
    }
}
