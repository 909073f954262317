package com.pennywise_sync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "pennywise")
public class BudgetProperties {
    // Bucket that receives distribution remainders and funds resets
    @NotBlank
    private String othersBucketName = "Others";
    // Only transactions in this category (exact, case-sensitive) can be distributed
    @NotBlank
    private String incomeCategoryName = "Income";
    @Min(1)
    private int defaultPageSize = 20;
    @Min(1)
    private int maxPageSize = 200;

    public int pageSize(Integer requested) {
        if (requested == null || requested < 1) return defaultPageSize;
        return Math.min(requested, maxPageSize);
    }
}
