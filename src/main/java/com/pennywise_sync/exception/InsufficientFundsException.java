package com.pennywise_sync.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Getter
public class InsufficientFundsException extends BudgetException {

    private final BigDecimal needed;
    private final BigDecimal available;

    public InsufficientFundsException(BigDecimal needed, BigDecimal available) {
        this("Insufficient funds", needed, available);
    }

    public InsufficientFundsException(String prefix, BigDecimal needed, BigDecimal available) {
        super(prefix + ". Needed: " + twoDecimals(needed) + ", Available: " + twoDecimals(available));
        this.needed = needed;
        this.available = available;
    }

    static String twoDecimals(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
