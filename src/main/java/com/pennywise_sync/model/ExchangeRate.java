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
@Table("exchange_rates")
public class ExchangeRate {

    @Id
    private Long id;

    @Column("from_currency")
    private String fromCurrency;

    @Column("to_currency")
    private String toCurrency;

    @Column("rate")
    private BigDecimal rate;

    @Column("provider")
    private String provider;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("updated_at_unix")
    private Long updatedAtUnix;

    @Column("expires_at")
    private LocalDateTime expiresAt;

    @Column("expires_at_unix")
    private Long expiresAtUnix;
}
