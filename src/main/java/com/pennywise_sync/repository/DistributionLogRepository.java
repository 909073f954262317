package com.pennywise_sync.repository;

import com.pennywise_sync.model.DistributionLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface DistributionLogRepository extends ReactiveCrudRepository<DistributionLog, Long> {
    Flux<DistributionLog> findByEventIdOrderByIdAsc(Long eventId);
}
