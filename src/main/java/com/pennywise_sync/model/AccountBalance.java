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
@Table("account_balances")
public class AccountBalance {

    @Id
    private Long id;

    @Column("bank_name")
    private String bankName;

    @Column("account_last4")
    private String accountLast4;

    @Column("balance")
    private BigDecimal balance;

    // "timestamp" on the device; renamed column, it is a reserved word in some dialects
    @Column("recorded_at")
    private LocalDateTime timestamp;

    @Column("transaction_id")
    private Long transactionId;

    @Column("credit_limit")
    private BigDecimal creditLimit;

    @Column("is_credit_card")
    private Boolean isCreditCard;

    @Column("sms_source")
    private String smsSource;

    @Column("source_type")
    private String sourceType;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("currency")
    private String currency;
}
