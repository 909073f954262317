package com.pennywise_sync.controller;

import com.pennywise_sync.dto.*;
import com.pennywise_sync.model.Bucket;
import com.pennywise_sync.model.Category;
import com.pennywise_sync.model.Transaction;
import com.pennywise_sync.model.TransferLog;
import com.pennywise_sync.service.AuditQueryService;
import com.pennywise_sync.service.BudgetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/budget")
public class BudgetController {

    private final BudgetService budgetService;

    private final AuditQueryService auditQueryService;

    @PostMapping("/distribute")
    public Mono<ResponseEntity<ApiResponse<DistributionResult>>> distribute(
            @Valid @RequestBody DistributeRequest request) {
        return budgetService.distribute(request.transactionId())
                .map(result -> ResponseEntity.ok(ApiResponse.ok(result)));
    }

    @PostMapping("/transfer")
    public Mono<ResponseEntity<ApiResponse<TransferResult>>> transfer(
            @Valid @RequestBody TransferRequest request) {
        return budgetService.transfer(request.fromBucketId(), request.toBucketId(),
                        request.amount(), request.transferAll())
                .map(result -> ResponseEntity.ok(ApiResponse.ok(result)));
    }

    @PostMapping("/buckets/{id}/reset")
    public Mono<ResponseEntity<ApiResponse<ResetResult>>> reset(@PathVariable("id") Long bucketId) {
        return budgetService.reset(bucketId)
                .map(result -> ResponseEntity.ok(ApiResponse.ok(result)));
    }

    @PostMapping("/distributions/{id}/revert")
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> revert(@PathVariable("id") Long eventId) {
        return budgetService.revertDistribution(eventId)
                .thenReturn(ResponseEntity.ok(ApiResponse.<Map<String, Object>>ok(
                        Map.of("event_id", eventId, "reverted", true))));
    }

    @GetMapping("/distributions")
    public Mono<ResponseEntity<ApiResponse<List<DistributionEventView>>>> distributions(
            @RequestParam(name = "limit", required = false) Integer limit) {
        return auditQueryService.listDistributionEvents(limit)
                .collectList()
                .map(events -> ResponseEntity.ok(ApiResponse.ok(events)));
    }

    @GetMapping("/buckets")
    public Mono<ResponseEntity<ApiResponse<List<Bucket>>>> buckets() {
        return budgetService.listBuckets()
                .collectList()
                .map(buckets -> ResponseEntity.ok(ApiResponse.ok(buckets)));
    }

    @PostMapping("/buckets")
    public Mono<ResponseEntity<ApiResponse<Bucket>>> createBucket(@Valid @RequestBody BucketRequest request) {
        return budgetService.createBucket(request.name(), request.monthlyAmount())
                .map(bucket -> ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(bucket)));
    }

    @PutMapping("/buckets/{id}")
    public Mono<ResponseEntity<ApiResponse<Bucket>>> updateMonthlyAmount(
            @PathVariable("id") Long bucketId, @Valid @RequestBody MonthlyAmountRequest request) {
        return budgetService.updateMonthlyAmount(bucketId, request.monthlyAmount())
                .map(bucket -> ResponseEntity.ok(ApiResponse.ok(bucket)));
    }

    @GetMapping("/categories")
    public Mono<ResponseEntity<ApiResponse<List<Category>>>> categories() {
        return budgetService.listCategories()
                .collectList()
                .map(categories -> ResponseEntity.ok(ApiResponse.ok(categories)));
    }

    @GetMapping("/income-transactions")
    public Mono<ResponseEntity<ApiResponse<List<Transaction>>>> incomeTransactions(
            @RequestParam(name = "limit", required = false) Integer limit) {
        return budgetService.listIncomeTransactions(limit)
                .collectList()
                .map(transactions -> ResponseEntity.ok(ApiResponse.ok(transactions)));
    }

    @GetMapping("/transfers")
    public Mono<ResponseEntity<ApiResponse<List<TransferLog>>>> transfers(
            @RequestParam(name = "limit", required = false) Integer limit) {
        return auditQueryService.listTransfers(limit)
                .collectList()
                .map(transfers -> ResponseEntity.ok(ApiResponse.ok(transfers)));
    }
}
