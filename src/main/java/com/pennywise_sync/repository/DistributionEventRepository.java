package com.pennywise_sync.repository;

import com.pennywise_sync.model.DistributionEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

public interface DistributionEventRepository extends ReactiveCrudRepository<DistributionEvent, Long> {
    Flux<DistributionEvent> findAllByOrderByIdDesc(Pageable pageable);

    // 1 when this call flipped the flag, 0 when the event was already reverted
    @Modifying
    @Query("UPDATE distribution_events SET is_reverted = TRUE, reverted_at = :revertedAt WHERE id = :id AND is_reverted = FALSE")
    Mono<Integer> markReverted(Long id, OffsetDateTime revertedAt);
}
