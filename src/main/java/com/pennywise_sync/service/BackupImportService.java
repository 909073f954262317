package com.pennywise_sync.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pennywise_sync.backup.dto.DatabaseSnapshot;
import com.pennywise_sync.backup.dto.PennyWiseBackup;
import com.pennywise_sync.exception.InternalException;
import com.pennywise_sync.importer.*;
import com.pennywise_sync.model.ImportLog;
import com.pennywise_sync.model.ImportStatus;
import com.pennywise_sync.repository.ImportLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.pennywise_sync.importer.SnapshotEntities.*;

/**
 * Reconciles the store with one device backup.
 * <p>
 * The run is recorded as an {@link ImportLog} committed up front. All merges then happen in
 * a single transaction: either every collection lands and the log is COMPLETED, or nothing
 * lands and the log is marked FAILED in a transaction of its own.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackupImportService {

    private final ImportLogRepository importLogRepository;
    private final EntityMerger entityMerger;
    private final CategoryBuckets categoryBuckets;
    private final TransactionReconciler transactionReconciler;
    private final TransactionalOperator transactionalOperator;

    public Mono<ImportLog> processBackup(PennyWiseBackup backup, String filename) {
        ImportLog started = ImportLog.builder()
                .filename(filename)
                .status(ImportStatus.STARTED)
                .startedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        return importLogRepository.save(started)
                .as(transactionalOperator::transactional)
                .flatMap(importLog -> {
                    log.info("Import {} started for '{}'", importLog.getId(), filename);
                    DatabaseSnapshot database = backup.database();
                    if (database == null) {
                        log.info("Import {} has no database section", importLog.getId());
                        return complete(importLog);
                    }
                    return mergeDatabase(database, importLog.getId())
                            .then(Mono.defer(() -> complete(importLog)))
                            .as(transactionalOperator::transactional)
                            .onErrorResume(error -> markFailed(importLog, error)
                                    .then(Mono.<ImportLog>error(InternalException.wrap(error))));
                });
    }

    // Categories and cards before transactions, then the soft-delete pass, then the rest
    private Mono<Void> mergeDatabase(DatabaseSnapshot database, Long importLogId) {
        List<ObjectNode> transactions = transactionReconciler.prepare(database.transactions());
        return entityMerger.mergeAll(CATEGORIES, database.categories(), importLogId, categoryBuckets)
                .then(entityMerger.mergeAll(CARDS, database.cards(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(TRANSACTIONS, transactions, importLogId, transactionReconciler))
                .then(Mono.defer(() -> transactions == null
                        ? Mono.empty()
                        : transactionReconciler.softDeleteMissing(transactions, importLogId)))
                .then(entityMerger.mergeAll(ACCOUNT_BALANCES, database.accountBalances(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(SUBSCRIPTIONS, database.subscriptions(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(MERCHANT_MAPPINGS, database.merchantMappings(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(UNRECOGNIZED_SMS, database.unrecognizedSms(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(CHAT_MESSAGES, database.chatMessages(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(TRANSACTION_RULES, database.transactionRules(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(RULE_APPLICATIONS, database.ruleApplications(), importLogId, MergeHook.none()))
                .then(entityMerger.mergeAll(EXCHANGE_RATES, database.exchangeRates(), importLogId, MergeHook.none()))
                .then();
    }

    private Mono<ImportLog> complete(ImportLog importLog) {
        return importLogRepository.save(importLog.toBuilder()
                        .status(ImportStatus.COMPLETED)
                        .completedAt(OffsetDateTime.now(ZoneOffset.UTC))
                        .build())
                .doOnNext(done -> log.info("Import {} completed", done.getId()));
    }

    private Mono<Void> markFailed(ImportLog importLog, Throwable error) {
        log.error("Import {} failed: {}", importLog.getId(), error.getMessage(), error);
        return importLogRepository.save(importLog.toBuilder()
                        .status(ImportStatus.FAILED)
                        .errorMessage(String.valueOf(error.getMessage()))
                        .completedAt(OffsetDateTime.now(ZoneOffset.UTC))
                        .build())
                .as(transactionalOperator::transactional)
                .onErrorResume(inner -> {
                    // The original failure still propagates to the caller
                    log.error("Could not record failure of import {}", importLog.getId(), inner);
                    return Mono.empty();
                })
                .then();
    }
}
