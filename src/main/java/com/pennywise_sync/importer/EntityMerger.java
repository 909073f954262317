package com.pennywise_sync.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pennywise_sync.model.ImportRowLog;
import com.pennywise_sync.model.RowAction;
import com.pennywise_sync.repository.ImportRowLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeanWrapperImpl;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Natural-key upsert of snapshot records.
 * <p>
 * A record is bound onto a typed candidate, matched against the store by its descriptor's
 * natural key, then inserted (ADDED), overwritten field by field (UPDATED) or left alone
 * (SKIPPED). Only fields present in the record take part: an omitted field, or one sent
 * as JSON null, never overwrites a stored value. Records missing any key value are
 * dropped without a row log. Every other record produces exactly one {@link ImportRowLog}.
 */
@Slf4j
@Component
public class EntityMerger {

    private final R2dbcEntityTemplate template;
    private final ImportRowLogRepository importRowLogRepository;
    private final ObjectMapper recordMapper;

    // entity class -> (snake_case json name -> java property)
    private final Map<Class<?>, Map<String, String>> propertyNames = new ConcurrentHashMap<>();

    public EntityMerger(R2dbcEntityTemplate template,
                        ImportRowLogRepository importRowLogRepository,
                        ObjectMapper objectMapper) {
        this.template = template;
        this.importRowLogRepository = importRowLogRepository;
        this.recordMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .registerModule(new SimpleModule("pennywise-device-dates")
                        .addDeserializer(LocalDateTime.class, new DeviceDateTimeDeserializer()));
    }

    public <E> Mono<MergeSummary> mergeAll(EntityDescriptor<E> descriptor,
                                           List<ObjectNode> records,
                                           Long importLogId,
                                           MergeHook<E> hook) {
        if (records == null || records.isEmpty()) {
            return Mono.just(MergeSummary.empty(descriptor.table()));
        }
        return Flux.fromIterable(records)
                .concatMap(record -> merge(descriptor, record, importLogId, hook))
                .reduce(MergeSummary.empty(descriptor.table()), MergeSummary::add)
                .doOnNext(summary -> log.info("Import {} merged {}", importLogId, summary));
    }

    /**
     * Merges one record; empty when the record was dropped for a missing key value.
     */
    public <E> Mono<RowAction> merge(EntityDescriptor<E> descriptor,
                                     ObjectNode record,
                                     Long importLogId,
                                     MergeHook<E> hook) {
        return Mono.fromCallable(() -> bind(descriptor, record))
                .flatMap(candidate -> {
                    BeanWrapper incoming = new BeanWrapperImpl(candidate);
                    List<Criteria> filters = new ArrayList<>();
                    for (String key : descriptor.naturalKey()) {
                        Object value = incoming.getPropertyValue(key);
                        if (value == null) {
                            log.debug("Skipping {} record without {}: {}", descriptor.table(), key, record);
                            return Mono.<MergeOutcome<E>>empty();
                        }
                        filters.add(Criteria.where(key).is(value));
                    }
                    Set<String> provided = providedProperties(descriptor, record);
                    return template.select(descriptor.type())
                            .matching(Query.query(Criteria.from(filters)))
                            .first()
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .flatMap(existing -> existing.isPresent()
                                    ? update(existing.get(), incoming, provided)
                                    : insert(candidate));
                })
                .flatMap(outcome -> hook.afterMerge(outcome)
                        .then(Mono.defer(() -> logRow(importLogId, descriptor.table(), outcome.action(),
                                idOf(descriptor, outcome.entity()))))
                        .thenReturn(outcome.action()));
    }

    public Mono<Void> logRow(Long importLogId, String table, RowAction action, Object entityId) {
        return importRowLogRepository.save(ImportRowLog.builder()
                        .importLogId(importLogId)
                        .action(action)
                        .entityType(table)
                        .entityId(entityId == null ? null : String.valueOf(entityId))
                        .build())
                .then();
    }

    private <E> E bind(EntityDescriptor<E> descriptor, ObjectNode record) throws JsonProcessingException {
        E candidate = recordMapper.treeToValue(record, descriptor.type());
        if (!descriptor.assignedId()) {
            new BeanWrapperImpl(candidate).setPropertyValue(descriptor.idProperty(), null);
        }
        return candidate;
    }

    private <E> Mono<MergeOutcome<E>> insert(E candidate) {
        return template.insert(candidate)
                .map(saved -> new MergeOutcome<>(RowAction.ADDED, saved));
    }

    private <E> Mono<MergeOutcome<E>> update(E existing,
                                             BeanWrapper incoming,
                                             Set<String> provided) {
        BeanWrapper stored = new BeanWrapperImpl(existing);
        boolean changed = false;
        for (String property : provided) {
            Object value = incoming.getPropertyValue(property);
            if (!sameValue(stored.getPropertyValue(property), value)) {
                stored.setPropertyValue(property, value);
                changed = true;
            }
        }
        if (!changed) {
            return Mono.just(new MergeOutcome<>(RowAction.SKIPPED, existing));
        }
        return template.update(existing)
                .map(saved -> new MergeOutcome<>(RowAction.UPDATED, saved));
    }

    Set<String> providedProperties(EntityDescriptor<?> descriptor, ObjectNode record) {
        Map<String, String> names = propertyNames.computeIfAbsent(descriptor.type(), this::introspect);
        Set<String> provided = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String property = names.get(field.getKey());
            if (property != null && !field.getValue().isNull() && descriptor.isMergeable(property)) {
                provided.add(property);
            }
        }
        return provided;
    }

    private Map<String, String> introspect(Class<?> type) {
        BeanDescription description = recordMapper.getDeserializationConfig()
                .introspect(recordMapper.constructType(type));
        Map<String, String> names = new HashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            names.put(property.getName(), property.getInternalName());
        }
        return names;
    }

    private static Object idOf(EntityDescriptor<?> descriptor, Object entity) {
        return new BeanWrapperImpl(entity).getPropertyValue(descriptor.idProperty());
    }

    // Decimals compare by value at the stored scale: "500" matches 500.00, 10.555 matches 10.56
    static boolean sameValue(Object stored, Object incoming) {
        if (stored instanceof BigDecimal a && incoming instanceof BigDecimal b) {
            return a.compareTo(b.setScale(a.scale(), RoundingMode.HALF_UP)) == 0;
        }
        return Objects.equals(stored, incoming);
    }
}
