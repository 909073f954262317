package com.pennywise_sync.repository;

import com.pennywise_sync.model.ImportRowLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface ImportRowLogRepository extends ReactiveCrudRepository<ImportRowLog, Long> {
    Flux<ImportRowLog> findByImportLogIdOrderByIdAsc(Long importLogId);
}
