package com.pennywise_sync.repository;

import com.pennywise_sync.model.Bucket;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

public interface BucketRepository extends R2dbcRepository<Bucket, Long> {

    Mono<Bucket> findByName(String name);

    Flux<Bucket> findAllByOrderByNameAsc();

    // Row lock held until the surrounding transaction ends
    @Query("SELECT * FROM buckets WHERE id = :id FOR UPDATE")
    Mono<Bucket> findByIdForUpdate(Long id);

    @Modifying
    @Query("UPDATE buckets SET balance = balance + :delta, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    Mono<Integer> addToBalance(Long id, BigDecimal delta);
}
