package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record DistributeRequest(
        @NotNull @JsonProperty("transaction_id") Long transactionId
) {}
