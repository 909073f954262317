package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

public record BucketRequest(
        @NotBlank @JsonProperty("name") String name,
        @JsonProperty("monthly_amount") BigDecimal monthlyAmount
) {}
