package com.pennywise_sync.repository;

import com.pennywise_sync.model.ImportLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface ImportLogRepository extends ReactiveCrudRepository<ImportLog, Long> {
    Flux<ImportLog> findAllByOrderByIdDesc(Pageable pageable);
}
