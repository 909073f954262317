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
@Table("transactions")
public class Transaction {

    public static final String INCOME = "INCOME";
    public static final String EXPENSE = "EXPENSE";

    @Id
    private Long id;

    // Content hash computed on the device, unique
    @Column("transaction_hash")
    private String transactionHash;

    // Unsigned; the sign comes from transactionType
    @Column("amount")
    private BigDecimal amount;

    @Column("merchant_name")
    private String merchantName;

    // Free-text match against Category.name
    @Column("category")
    private String category;

    @Column("transaction_type")
    private String transactionType; // INCOME, EXPENSE, TRANSFER, CREDIT, INVESTMENT

    @Column("date_time")
    private LocalDateTime dateTime;

    @Column("description")
    private String description;

    @Column("sms_body")
    private String smsBody;

    @Column("bank_name")
    private String bankName;

    @Column("sms_sender")
    private String smsSender;

    @Column("account_number")
    private String accountNumber;

    @Column("balance_after")
    private BigDecimal balanceAfter;

    @Column("is_recurring")
    private Boolean isRecurring;

    @Column("is_deleted")
    private Boolean isDeleted;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("currency")
    private String currency;

    @Column("from_account")
    private String fromAccount;

    @Column("to_account")
    private String toAccount;

    // Bucket delta currently in force for this row; reversed exactly on update or deletion
    @Column("applied_bucket_id")
    private Long appliedBucketId;

    @Column("applied_amount")
    private BigDecimal appliedAmount;

    public boolean deleted() {
        return Boolean.TRUE.equals(isDeleted);
    }
}
