package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("buckets")
public class Bucket {

    @Id
    private Long id;

    @Column("name")
    private String name; // unique

    // Target allocation per income distribution; null counts as zero
    @Column("monthly_amount")
    private BigDecimal monthlyAmount;

    // Running total of applied deltas, may be negative
    @Column("balance")
    private BigDecimal balance;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;

    public static Bucket named(String name, BigDecimal monthlyAmount) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        return Bucket.builder()
                .name(name)
                .monthlyAmount(monthlyAmount)
                .balance(BigDecimal.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public BigDecimal monthlyOrZero() {
        return monthlyAmount == null ? BigDecimal.ZERO : monthlyAmount;
    }

    public BigDecimal balanceOrZero() {
        return balance == null ? BigDecimal.ZERO : balance;
    }
}
