package com.pennywise_sync.importer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pennywise_sync.ledger.BalanceEffect;
import com.pennywise_sync.ledger.BalanceLedger;
import com.pennywise_sync.model.RowAction;
import com.pennywise_sync.model.Transaction;
import com.pennywise_sync.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.*;

/**
 * Keeps bucket balances equal to the net effect of the live transactions.
 * <p>
 * Each stored transaction remembers the delta it currently holds on a bucket
 * ({@code appliedBucketId}/{@code appliedAmount}). Whenever the row is added, revised,
 * or soft-deleted, that delta is reversed and the effect of the row's new state is
 * applied in its place, so a transaction revised across many backups still counts once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionReconciler implements MergeHook<Transaction> {

    static final String IS_DELETED = "is_deleted";
    static final String TRANSACTION_HASH = "transaction_hash";

    private final CategoryBuckets categoryBuckets;
    private final BalanceLedger balanceLedger;
    private final TransactionRepository transactionRepository;
    private final EntityMerger entityMerger;

    /**
     * A transaction present in a backup is live unless the record itself says otherwise,
     * which also revives a row an earlier backup soft-deleted.
     */
    public List<ObjectNode> prepare(List<ObjectNode> records) {
        if (records == null) {
            return null;
        }
        List<ObjectNode> prepared = new ArrayList<>(records.size());
        for (ObjectNode record : records) {
            if (record.hasNonNull(IS_DELETED)) {
                prepared.add(record);
            } else {
                ObjectNode live = record.deepCopy();
                live.put(IS_DELETED, false);
                prepared.add(live);
            }
        }
        return prepared;
    }

    @Override
    public Mono<Void> afterMerge(MergeOutcome<Transaction> outcome) {
        if (outcome.action() == RowAction.SKIPPED) {
            return Mono.empty();
        }
        return settle(outcome.entity());
    }

    /**
     * Soft-deletes every live stored transaction whose hash is not among {@code records},
     * reversing its balance effect. Returns the number of rows deleted.
     */
    public Mono<Long> softDeleteMissing(List<ObjectNode> records, Long importLogId) {
        Set<String> present = new HashSet<>();
        for (ObjectNode record : records) {
            String hash = record.path(TRANSACTION_HASH).asText(null);
            if (hash != null) {
                present.add(hash);
            }
        }
        return transactionRepository.findByIsDeletedFalse()
                .filter(tx -> !present.contains(tx.getTransactionHash()))
                .collectList()
                .flatMapMany(Flux::fromIterable)
                .concatMap(tx -> {
                    tx.setIsDeleted(true);
                    return settle(tx)
                            .then(entityMerger.logRow(importLogId, SnapshotEntities.TRANSACTIONS.table(),
                                    RowAction.DELETED, tx.getId()))
                            .thenReturn(tx);
                })
                .count()
                .doOnNext(count -> {
                    if (count > 0) log.info("Import {} soft-deleted {} transactions missing from the backup", importLogId, count);
                });
    }

    /**
     * Replaces the delta the row currently holds with the effect of its current state and
     * persists the row.
     */
    Mono<Void> settle(Transaction tx) {
        BigDecimal effect = BalanceEffect.of(tx);
        Mono<Optional<Long>> target = effect.signum() == 0
                ? Mono.just(Optional.empty())
                : categoryBuckets.bucketFor(tx.getCategory())
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty());
        return target.flatMap(bucket -> {
            if (bucket.isEmpty() && effect.signum() != 0) {
                log.debug("Transaction {} has no resolvable category '{}', balance untouched",
                        tx.getTransactionHash(), tx.getCategory());
            }
            Long newBucket = bucket.orElse(null);
            BigDecimal newAmount = newBucket == null ? null : effect;
            SortedMap<Long, BigDecimal> deltas = BalanceEffect.plan(
                    tx.getAppliedBucketId(), tx.getAppliedAmount(), newBucket, newAmount);
            tx.setAppliedBucketId(newBucket);
            tx.setAppliedAmount(newAmount);
            return Flux.fromIterable(deltas.entrySet())
                    .concatMap(delta -> balanceLedger.applyDelta(delta.getKey(), delta.getValue()))
                    .then(Mono.defer(() -> transactionRepository.save(tx)))
                    .then();
        });
    }
}
