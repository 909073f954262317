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
@Table("transaction_rules")
public class TransactionRule {

    @Id
    private String id;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("priority")
    private Integer priority;

    // JSON documents kept verbatim
    @Column("conditions")
    private String conditions;

    @Column("actions")
    private String actions;

    @Column("is_active")
    private Boolean isActive;

    @Column("is_system_template")
    private Boolean isSystemTemplate;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
