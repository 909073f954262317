package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("import_row_logs")
public class ImportRowLog {

    @Id
    private Long id;

    @Column("import_log_id")
    private Long importLogId;

    @Column("action")
    private RowAction action;

    // Table of the merged entity, e.g. "transactions"
    @Column("entity_type")
    private String entityType;

    // Primary key of the merged row, as text (some tables use string keys)
    @Column("entity_id")
    private String entityId;
}
