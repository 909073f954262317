package com.pennywise_sync.service;

import com.pennywise_sync.config.BudgetProperties;
import com.pennywise_sync.dto.DistributionResult;
import com.pennywise_sync.dto.ResetResult;
import com.pennywise_sync.dto.TransferResult;
import com.pennywise_sync.exception.*;
import com.pennywise_sync.ledger.BalanceLedger;
import com.pennywise_sync.model.*;
import com.pennywise_sync.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bucket budget ledger: income distribution, transfers, resets and distribution reverts.
 * <p>
 * Each public mutation runs in one store transaction. Validation happens before the first
 * balance changes; any later failure rolls the whole operation back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetService {

    private final BucketRepository bucketRepository;
    private final CategoryRepository categoryRepository;
    private final TransactionRepository transactionRepository;
    private final DistributionEventRepository distributionEventRepository;
    private final DistributionLogRepository distributionLogRepository;
    private final TransferLogRepository transferLogRepository;
    private final BalanceLedger balanceLedger;
    private final OthersBucketResolver othersBucket;
    private final BudgetProperties properties;

    /**
     * Splits an income transaction across the buckets: every bucket other than Others receives
     * its monthly amount, Others receives what is left.
     */
    @Transactional
    public Mono<DistributionResult> distribute(Long transactionId) {
        return transactionRepository.findById(transactionId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Transaction", transactionId)))
                .flatMap(tx -> {
                    checkDistributable(tx);
                    return othersBucket.resolve().flatMap(others -> allocate(tx, others));
                })
                .doOnError(BudgetException.class, e -> log.warn("Distribution of transaction {} rejected: {}", transactionId, e.getMessage()))
                .onErrorMap(InternalException::wrap);
    }

    private void checkDistributable(Transaction tx) {
        if (tx.deleted()) {
            throw new InvalidStateException("Transaction " + tx.getId() + " is deleted");
        }
        if (!Transaction.INCOME.equals(tx.getTransactionType())
                || !properties.getIncomeCategoryName().equals(tx.getCategory())) {
            throw new InvalidStateException("Transaction must be of category '"
                    + properties.getIncomeCategoryName() + "' and type '" + Transaction.INCOME + "'");
        }
        if (tx.getAmount() == null) {
            throw new InvalidStateException("Transaction " + tx.getId() + " has no amount");
        }
    }

    private Mono<DistributionResult> allocate(Transaction tx, Bucket others) {
        return bucketRepository.findAll(Sort.by("id"))
                .filter(bucket -> !bucket.getId().equals(others.getId()))
                .collectList()
                .flatMap(buckets -> {
                    BigDecimal amount = tx.getAmount();
                    BigDecimal needed = buckets.stream()
                            .map(Bucket::monthlyOrZero)
                            .reduce(BigDecimal.ZERO, BigDecimal::add);
                    if (amount.compareTo(needed) < 0) {
                        return Mono.<DistributionResult>error(new InsufficientFundsException(needed, amount));
                    }

                    // bucket id -> share, in allocation order
                    Map<Long, BigDecimal> shares = new LinkedHashMap<>();
                    BigDecimal allocated = BigDecimal.ZERO;
                    for (Bucket bucket : buckets) {
                        if (bucket.monthlyOrZero().signum() > 0) {
                            shares.put(bucket.getId(), bucket.getMonthlyAmount());
                            allocated = allocated.add(bucket.getMonthlyAmount());
                        }
                    }
                    BigDecimal remainder = amount.subtract(allocated);
                    if (remainder.signum() > 0) {
                        shares.put(others.getId(), remainder);
                    }

                    DistributionEvent event = DistributionEvent.builder()
                            .transactionId(tx.getId())
                            .totalAmount(amount)
                            .reverted(false)
                            .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                            .build();
                    BigDecimal allocatedTotal = allocated;
                    return distributionEventRepository.save(event)
                            .flatMap(saved -> Flux.fromIterable(shares.entrySet())
                                    .concatMap(share -> balanceLedger.applyDelta(share.getKey(), share.getValue())
                                            .then(distributionLogRepository.save(DistributionLog.builder()
                                                    .eventId(saved.getId())
                                                    .bucketId(share.getKey())
                                                    .amount(share.getValue())
                                                    .build())))
                                    .then(Mono.fromSupplier(() -> {
                                        log.info("Distributed transaction {} as event {}: allocated={}, remainder={}",
                                                tx.getId(), saved.getId(), allocatedTotal, remainder);
                                        return DistributionResult.builder()
                                                .eventId(saved.getId())
                                                .allocated(allocatedTotal)
                                                .remainder(remainder)
                                                .build();
                                    })));
                });
    }

    /**
     * Moves {@code amount} (or, with {@code transferAll}, the whole source balance) between
     * two buckets. The source may not go negative. An empty source moves nothing and reports zero.
     */
    @Transactional
    public Mono<TransferResult> transfer(Long fromBucketId, Long toBucketId, BigDecimal amount, boolean transferAll) {
        return Mono.defer(() -> {
                    checkTransfer(fromBucketId, toBucketId, amount, transferAll);
                    return lockPair(fromBucketId, toBucketId);
                })
                .flatMap(pair -> {
                    Bucket from = pair.getT1();
                    Bucket to = pair.getT2();
                    BigDecimal available = from.balanceOrZero();
                    BigDecimal moved = transferAll ? available.max(BigDecimal.ZERO) : amount;
                    if (moved.signum() == 0) {
                        log.info("Bucket {} has nothing to transfer", from.getId());
                        return Mono.just(new TransferResult(BigDecimal.ZERO));
                    }
                    if (available.subtract(moved).signum() < 0) {
                        return Mono.<TransferResult>error(new InsufficientFundsException(
                                "Insufficient funds in source bucket", moved, available));
                    }
                    return move(TransferKind.TRANSFER, from, to, moved)
                            .doOnSuccess(v -> log.info("Transferred {} from bucket {} to bucket {}",
                                    moved, from.getId(), to.getId()))
                            .thenReturn(new TransferResult(moved));
                })
                .doOnError(BudgetException.class, e -> log.warn("Transfer {} -> {} rejected: {}", fromBucketId, toBucketId, e.getMessage()))
                .onErrorMap(InternalException::wrap);
    }

    private static void checkTransfer(Long fromBucketId, Long toBucketId, BigDecimal amount, boolean transferAll) {
        if (fromBucketId == null || toBucketId == null) {
            throw new BadRequestException("from_bucket_id and to_bucket_id are required");
        }
        if (fromBucketId.equals(toBucketId)) {
            throw new BadRequestException("Source and destination bucket must differ");
        }
        if (!transferAll) {
            if (amount == null) {
                throw new BadRequestException("Amount must be provided if transfer_all is false");
            }
            if (amount.signum() <= 0) {
                throw new BadRequestException("Amount must be positive");
            }
        }
    }

    /**
     * Brings a negative bucket back to zero with money from Others.
     */
    @Transactional
    public Mono<ResetResult> reset(Long bucketId) {
        return bucketRepository.findById(bucketId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Bucket", bucketId)))
                .flatMap(target -> {
                    checkNegative(target);
                    return othersBucket.find()
                            .switchIfEmpty(Mono.error(() -> new InternalException(
                                    "Bucket '" + othersBucket.name() + "' does not exist")))
                            .flatMap(others -> {
                                if (others.getId().equals(target.getId())) {
                                    return Mono.<Tuple2<Bucket, Bucket>>error(new InvalidStateException(
                                            "Bucket '" + othersBucket.name() + "' cannot be reset from itself"));
                                }
                                return lockPair(others.getId(), target.getId());
                            });
                })
                .flatMap(pair -> {
                    Bucket others = pair.getT1();
                    Bucket target = pair.getT2();
                    // the locked row may have moved since the first read
                    checkNegative(target);
                    BigDecimal needed = target.balanceOrZero().negate();
                    if (others.balanceOrZero().compareTo(needed) < 0) {
                        return Mono.<ResetResult>error(new InsufficientFundsException(
                                "Insufficient funds in " + others.getName(), needed, others.balanceOrZero()));
                    }
                    return move(TransferKind.RESET, others, target, needed)
                            .doOnSuccess(v -> log.info("Reset bucket {} with {} from {}", target.getId(), needed, others.getName()))
                            .thenReturn(new ResetResult(needed));
                })
                .doOnError(BudgetException.class, e -> log.warn("Reset of bucket {} rejected: {}", bucketId, e.getMessage()))
                .onErrorMap(InternalException::wrap);
    }

    private static void checkNegative(Bucket bucket) {
        if (bucket.balanceOrZero().signum() >= 0) {
            throw new InvalidStateException("Bucket " + bucket.getName() + " balance is not negative");
        }
    }

    /**
     * Subtracts every amount an event put into a bucket. An event is reverted at most once.
     */
    @Transactional
    public Mono<Void> revertDistribution(Long eventId) {
        return distributionEventRepository.findById(eventId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Distribution event", eventId)))
                .flatMap(event -> distributionEventRepository.markReverted(eventId, OffsetDateTime.now(ZoneOffset.UTC)))
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.<Void>error(new InvalidStateException("Distribution " + eventId + " is already reverted"));
                    }
                    return distributionLogRepository.findByEventIdOrderByIdAsc(eventId)
                            .concatMap(line -> balanceLedger.applyDelta(line.getBucketId(), line.getAmount().negate()))
                            .then(Mono.<Void>fromRunnable(() -> log.info("Reverted distribution {}", eventId)));
                })
                .doOnError(BudgetException.class, e -> log.warn("Revert of distribution {} rejected: {}", eventId, e.getMessage()))
                .onErrorMap(InternalException::wrap);
    }

    public Flux<Bucket> listBuckets() {
        return bucketRepository.findAllByOrderByNameAsc();
    }

    @Transactional
    public Mono<Bucket> createBucket(String name, BigDecimal monthlyAmount) {
        return Mono.defer(() -> {
                    if (name == null || name.isBlank()) {
                        return Mono.<Bucket>error(new BadRequestException("Bucket name is required"));
                    }
                    if (monthlyAmount != null && monthlyAmount.signum() < 0) {
                        return Mono.<Bucket>error(new BadRequestException("Monthly amount must not be negative"));
                    }
                    return bucketRepository.findByName(name)
                            .flatMap(existing -> Mono.<Bucket>error(new InvalidStateException("Bucket " + name + " already exists")))
                            .switchIfEmpty(Mono.defer(() -> bucketRepository.save(Bucket.named(name, monthlyAmount))));
                })
                .doOnNext(bucket -> log.info("Created bucket {} '{}'", bucket.getId(), bucket.getName()))
                .onErrorMap(InternalException::wrap);
    }

    @Transactional
    public Mono<Bucket> updateMonthlyAmount(Long bucketId, BigDecimal monthlyAmount) {
        return Mono.defer(() -> {
                    if (monthlyAmount == null || monthlyAmount.signum() < 0) {
                        return Mono.<Bucket>error(new BadRequestException("Monthly amount must not be negative"));
                    }
                    return bucketRepository.findById(bucketId);
                })
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Bucket", bucketId)))
                .flatMap(bucket -> bucketRepository.save(bucket.toBuilder()
                        .monthlyAmount(monthlyAmount)
                        .updatedAt(OffsetDateTime.now(ZoneOffset.UTC))
                        .build()))
                .onErrorMap(InternalException::wrap);
    }

    public Flux<Category> listCategories() {
        return categoryRepository.findAllByOrderByDisplayOrderAscNameAsc();
    }

    public Flux<Transaction> listIncomeTransactions(Integer limit) {
        return transactionRepository.findByCategoryAndTransactionTypeAndIsDeletedFalseOrderByDateTimeDesc(
                properties.getIncomeCategoryName(), Transaction.INCOME, PageRequest.of(0, properties.pageSize(limit)));
    }

    private Mono<Void> move(TransferKind kind, Bucket from, Bucket to, BigDecimal amount) {
        return balanceLedger.applyDelta(from.getId(), amount.negate())
                .then(balanceLedger.applyDelta(to.getId(), amount))
                .then(transferLogRepository.save(TransferLog.builder()
                        .kind(kind)
                        .fromBucketId(from.getId())
                        .toBucketId(to.getId())
                        .amount(amount)
                        .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                        .build()))
                .then();
    }

    // Locks both rows in ascending id order; the result keeps (first, second) argument order
    private Mono<Tuple2<Bucket, Bucket>> lockPair(Long first, Long second) {
        List<Long> order = first < second ? List.of(first, second) : List.of(second, first);
        return lockExisting(order.get(0))
                .flatMap(low -> lockExisting(order.get(1))
                        .map(high -> low.getId().equals(first) ? Tuples.of(low, high) : Tuples.of(high, low)));
    }

    private Mono<Bucket> lockExisting(Long bucketId) {
        return balanceLedger.lock(bucketId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Bucket", bucketId)));
    }
}
