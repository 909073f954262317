package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record MonthlyAmountRequest(
        @NotNull @JsonProperty("monthly_amount") BigDecimal monthlyAmount
) {}
