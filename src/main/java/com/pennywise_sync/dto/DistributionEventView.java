package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Builder
public record DistributionEventView(
        @JsonProperty("id") Long id,
        @JsonProperty("transaction_id") Long transactionId,
        @JsonProperty("timestamp") OffsetDateTime timestamp,
        @JsonProperty("total_amount") BigDecimal totalAmount,
        @JsonProperty("reverted") boolean reverted,
        @JsonProperty("logs") List<LogLine> logs
) {
    public record LogLine(
            @JsonProperty("bucket_name") String bucketName,
            @JsonProperty("amount") BigDecimal amount
    ) {}
}
