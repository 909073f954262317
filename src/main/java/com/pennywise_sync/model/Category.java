package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("categories")
public class Category {

    @Id
    private Long id;

    @Column("name")
    private String name; // unique, matched by Transaction.category

    @Column("color")
    private String color;

    @Column("is_system")
    private Boolean isSystem;

    @Column("is_income")
    private Boolean isIncome;

    @Column("display_order")
    private Integer displayOrder;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    // Owning bucket, assigned by the importer right after insert
    @Column("bucket_id")
    private Long bucketId;

    public BucketLink link() {
        return BucketLink.of(bucketId);
    }
}
