package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record DistributionResult(
        @JsonProperty("event_id") Long eventId,
        @JsonProperty("allocated") BigDecimal allocated,
        @JsonProperty("remainder") BigDecimal remainder
) {}
