package com.pennywise_sync.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class InsufficientFundsExceptionTest {

    @Test
    @DisplayName("Message carries both amounts with two decimals")
    void messageFormat() {
        InsufficientFundsException ex = new InsufficientFundsException(new BigDecimal("6000"), new BigDecimal("5000.5"));

        assertThat(ex.getMessage()).isEqualTo("Insufficient funds. Needed: 6000.00, Available: 5000.50");
        assertThat(ex.status()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getNeeded()).isEqualByComparingTo("6000");
    }

    @Test
    @DisplayName("Typed failures pass through wrap, anything else becomes internal")
    void wrap() {
        NotFoundException notFound = NotFoundException.of("Bucket", 9);
        IllegalStateException boom = new IllegalStateException("boom");

        assertThat(InternalException.wrap(notFound)).isSameAs(notFound);
        assertThat(InternalException.wrap(boom))
                .isInstanceOf(InternalException.class)
                .hasMessage("boom")
                .hasCause(boom);
        assertThat(notFound.getMessage()).isEqualTo("Bucket not found: 9");
    }
}
