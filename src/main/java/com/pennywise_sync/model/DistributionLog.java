package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("distribution_logs")
public class DistributionLog {

    @Id
    private Long id;

    @Column("event_id")
    private Long eventId;

    @Column("bucket_id")
    private Long bucketId;

    // Signed delta applied to the bucket by the parent event
    @Column("amount")
    private BigDecimal amount;
}
