package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record TransferRequest(
        @NotNull @JsonProperty("from_bucket_id") Long fromBucketId,
        @NotNull @JsonProperty("to_bucket_id") Long toBucketId,
        @JsonProperty("amount") BigDecimal amount,            // required unless transfer_all
        @JsonProperty("transfer_all") boolean transferAll
) {}
