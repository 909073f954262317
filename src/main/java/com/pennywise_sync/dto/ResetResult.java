package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record ResetResult(
        @JsonProperty("transferred_amount") BigDecimal transferredAmount
) {}
