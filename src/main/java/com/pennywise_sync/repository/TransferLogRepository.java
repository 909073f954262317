package com.pennywise_sync.repository;

import com.pennywise_sync.model.TransferLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface TransferLogRepository extends ReactiveCrudRepository<TransferLog, Long> {
    Flux<TransferLog> findAllByOrderByIdDesc(Pageable pageable);
}
