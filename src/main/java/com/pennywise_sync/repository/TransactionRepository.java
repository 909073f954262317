package com.pennywise_sync.repository;

import com.pennywise_sync.model.Transaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface TransactionRepository extends ReactiveCrudRepository<Transaction, Long> {
    Mono<Transaction> findByTransactionHash(String transactionHash);
    Flux<Transaction> findByIsDeletedFalse();
    Flux<Transaction> findByCategoryAndTransactionTypeAndIsDeletedFalseOrderByDateTimeDesc(
            String category, String transactionType, Pageable pageable);
}
