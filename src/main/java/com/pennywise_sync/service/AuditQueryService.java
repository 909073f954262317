package com.pennywise_sync.service;

import com.pennywise_sync.config.BudgetProperties;
import com.pennywise_sync.dto.DistributionEventView;
import com.pennywise_sync.exception.NotFoundException;
import com.pennywise_sync.model.*;
import com.pennywise_sync.repository.*;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Read side of the audit trail: distribution events, transfers and import runs.
 */
@Service
@RequiredArgsConstructor
public class AuditQueryService {

    private final DistributionEventRepository distributionEventRepository;
    private final DistributionLogRepository distributionLogRepository;
    private final TransferLogRepository transferLogRepository;
    private final BucketRepository bucketRepository;
    private final ImportLogRepository importLogRepository;
    private final ImportRowLogRepository importRowLogRepository;
    private final BudgetProperties properties;

    /** Most recent first, each with its per-bucket lines. */
    public Flux<DistributionEventView> listDistributionEvents(Integer limit) {
        return bucketRepository.findAll()
                .collectMap(Bucket::getId, Bucket::getName)
                .flatMapMany(bucketNames -> distributionEventRepository
                        .findAllByOrderByIdDesc(PageRequest.of(0, properties.pageSize(limit)))
                        .concatMap(event -> view(event, bucketNames)));
    }

    private Mono<DistributionEventView> view(DistributionEvent event, Map<Long, String> bucketNames) {
        return distributionLogRepository.findByEventIdOrderByIdAsc(event.getId())
                .map(line -> new DistributionEventView.LogLine(
                        bucketNames.getOrDefault(line.getBucketId(), "Unknown"), line.getAmount()))
                .collectList()
                .map(lines -> DistributionEventView.builder()
                        .id(event.getId())
                        .transactionId(event.getTransactionId())
                        .timestamp(event.getCreatedAt())
                        .totalAmount(event.getTotalAmount())
                        .reverted(event.alreadyReverted())
                        .logs(lines)
                        .build());
    }

    public Flux<TransferLog> listTransfers(Integer limit) {
        return transferLogRepository.findAllByOrderByIdDesc(PageRequest.of(0, properties.pageSize(limit)));
    }

    public Flux<ImportLog> listImportLogs(Integer limit) {
        return importLogRepository.findAllByOrderByIdDesc(PageRequest.of(0, properties.pageSize(limit)));
    }

    public Flux<ImportRowLog> listImportRows(Long importLogId) {
        return importLogRepository.findById(importLogId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Import log", importLogId)))
                .flatMapMany(found -> importRowLogRepository.findByImportLogIdOrderByIdAsc(importLogId));
    }
}
