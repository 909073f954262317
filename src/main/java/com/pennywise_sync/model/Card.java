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
@Table("cards")
public class Card {

    // Device-assigned id doubles as the natural key
    @Id
    private Long id;

    @Column("card_last4")
    private String cardLast4;

    @Column("card_type")
    private String cardType; // CREDIT, DEBIT

    @Column("bank_name")
    private String bankName;

    @Column("account_last4")
    private String accountLast4;

    @Column("nickname")
    private String nickname;

    @Column("is_active")
    private Boolean isActive;

    @Column("last_balance")
    private BigDecimal lastBalance;

    @Column("last_balance_source")
    private String lastBalanceSource;

    @Column("last_balance_date")
    private LocalDateTime lastBalanceDate;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("currency")
    private String currency;
}
