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
@Table("unrecognized_sms")
public class UnrecognizedSms {

    @Id
    private Long id;

    @Column("sender")
    private String sender;

    @Column("sms_body")
    private String smsBody;

    @Column("received_at")
    private LocalDateTime receivedAt;

    @Column("reported")
    private Boolean reported;

    @Column("is_deleted")
    private Boolean isDeleted;

    @Column("created_at")
    private LocalDateTime createdAt;
}
