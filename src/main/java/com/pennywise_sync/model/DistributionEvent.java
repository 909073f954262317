package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("distribution_events")
public class DistributionEvent {

    @Id
    private Long id;

    @Column("transaction_id")
    private Long transactionId;

    // Equals the sum of this event's DistributionLog amounts
    @Column("total_amount")
    private BigDecimal totalAmount;

    // Only ever flips false -> true
    @Column("is_reverted")
    private Boolean reverted;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("reverted_at")
    private OffsetDateTime revertedAt;

    public boolean alreadyReverted() {
        return Boolean.TRUE.equals(reverted);
    }
}
