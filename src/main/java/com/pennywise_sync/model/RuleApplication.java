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
@Table("rule_applications")
public class RuleApplication {

    @Id
    private String id;

    @Column("rule_id")
    private String ruleId;

    @Column("rule_name")
    private String ruleName;

    @Column("transaction_id")
    private String transactionId;

    @Column("fields_modified")
    private String fieldsModified;

    @Column("applied_at")
    private LocalDateTime appliedAt;
}
