package com.pennywise_sync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("subscriptions")
public class Subscription {

    @Id
    private Long id;

    @Column("merchant_name")
    private String merchantName;

    @Column("amount")
    private BigDecimal amount;

    @Column("next_payment_date")
    private LocalDateTime nextPaymentDate;

    @Column("state")
    private String state; // ACTIVE, HIDDEN

    @Column("bank_name")
    private String bankName;

    @Column("umn")
    private String umn;

    @Column("category")
    private String category;

    @Column("sms_body")
    private String smsBody;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("currency")
    private String currency;
}
