package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Audit row for a bucket-to-bucket move. The pair of deltas it stands for is
 * {@code -amount} on {@code fromBucketId} and {@code +amount} on {@code toBucketId}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("transfer_logs")
public class TransferLog {

    @Id
    private Long id;

    @Column("kind")
    private TransferKind kind;

    @Column("from_bucket_id")
    private Long fromBucketId;

    @Column("to_bucket_id")
    private Long toBucketId;

    @Column("amount")
    private BigDecimal amount;

    @Column("created_at")
    private OffsetDateTime createdAt;
}
