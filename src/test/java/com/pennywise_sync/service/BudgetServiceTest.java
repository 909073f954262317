package com.pennywise_sync.service;

import com.pennywise_sync.config.BudgetProperties;
import com.pennywise_sync.exception.BadRequestException;
import com.pennywise_sync.exception.InvalidStateException;
import com.pennywise_sync.exception.NotFoundException;
import com.pennywise_sync.ledger.BalanceLedger;
import com.pennywise_sync.model.DistributionEvent;
import com.pennywise_sync.model.Transaction;
import com.pennywise_sync.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Rejection paths of the budget ledger. Every case must fail before any balance moves.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("BudgetService validation")
class BudgetServiceTest {

    @Mock
    private BucketRepository bucketRepository;
    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private TransactionRepository transactionRepository;
    @Mock
    private DistributionEventRepository distributionEventRepository;
    @Mock
    private DistributionLogRepository distributionLogRepository;
    @Mock
    private TransferLogRepository transferLogRepository;
    @Mock
    private BalanceLedger balanceLedger;
    @Mock
    private OthersBucketResolver othersBucket;

    private BudgetService budgetService;

    @BeforeEach
    void setUp() {
        budgetService = new BudgetService(bucketRepository, categoryRepository, transactionRepository,
                distributionEventRepository, distributionLogRepository, transferLogRepository,
                balanceLedger, othersBucket, new BudgetProperties());
    }

    private static Transaction transaction(String type, String category) {
        return Transaction.builder()
                .id(1L)
                .transactionHash("hash-1")
                .amount(new BigDecimal("10000"))
                .transactionType(type)
                .category(category)
                .isDeleted(false)
                .build();
    }

    @Test
    @DisplayName("Distributing an unknown transaction is NotFound")
    void distributeUnknown() {
        when(transactionRepository.findById(1L)).thenReturn(Mono.empty());

        StepVerifier.create(budgetService.distribute(1L))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NotFoundException.class)
                        .hasMessage("Transaction not found: 1"))
                .verify();
        verifyNoInteractions(balanceLedger, distributionEventRepository);
    }

    @Test
    @DisplayName("Only INCOME transactions in the Income category can be distributed")
    void distributeWrongKind() {
        when(transactionRepository.findById(1L))
                .thenReturn(Mono.just(transaction(Transaction.EXPENSE, "Income")))
                .thenReturn(Mono.just(transaction(Transaction.INCOME, "income")));

        StepVerifier.create(budgetService.distribute(1L)).expectError(InvalidStateException.class).verify();
        StepVerifier.create(budgetService.distribute(1L)).expectError(InvalidStateException.class).verify();
        verifyNoInteractions(balanceLedger, othersBucket);
    }

    @Test
    @DisplayName("Deleted transactions cannot be distributed")
    void distributeDeleted() {
        Transaction deleted = transaction(Transaction.INCOME, "Income").toBuilder().isDeleted(true).build();
        when(transactionRepository.findById(1L)).thenReturn(Mono.just(deleted));

        StepVerifier.create(budgetService.distribute(1L)).expectError(InvalidStateException.class).verify();
        verifyNoInteractions(balanceLedger);
    }

    @Test
    @DisplayName("Transfer needs an amount unless transfer_all is set")
    void transferWithoutAmount() {
        StepVerifier.create(budgetService.transfer(1L, 2L, null, false))
                .expectError(BadRequestException.class)
                .verify();
        verifyNoInteractions(balanceLedger, transferLogRepository);
    }

    @Test
    @DisplayName("Transfer rejects non-positive amounts and same-bucket moves")
    void transferBadArguments() {
        StepVerifier.create(budgetService.transfer(1L, 2L, new BigDecimal("-5"), false))
                .expectError(BadRequestException.class)
                .verify();
        StepVerifier.create(budgetService.transfer(1L, 2L, BigDecimal.ZERO, false))
                .expectError(BadRequestException.class)
                .verify();
        StepVerifier.create(budgetService.transfer(3L, 3L, BigDecimal.TEN, false))
                .expectError(BadRequestException.class)
                .verify();
        verifyNoInteractions(balanceLedger);
    }

    @Test
    @DisplayName("A second revert is rejected and leaves balances alone")
    void revertTwice() {
        DistributionEvent reverted = DistributionEvent.builder().id(5L).reverted(true).build();
        when(distributionEventRepository.findById(5L)).thenReturn(Mono.just(reverted));
        when(distributionEventRepository.markReverted(eq(5L), any(OffsetDateTime.class))).thenReturn(Mono.just(0));

        StepVerifier.create(budgetService.revertDistribution(5L))
                .expectErrorMessage("Distribution 5 is already reverted")
                .verify();
        verifyNoInteractions(balanceLedger, distributionLogRepository);
    }

    @Test
    @DisplayName("Reverting an unknown event is NotFound")
    void revertUnknown() {
        when(distributionEventRepository.findById(8L)).thenReturn(Mono.empty());

        StepVerifier.create(budgetService.revertDistribution(8L))
                .expectError(NotFoundException.class)
                .verify();
        verify(distributionEventRepository, never()).markReverted(any(), any());
    }

    @Test
    @DisplayName("Monthly amounts cannot be negative")
    void negativeMonthlyAmount() {
        StepVerifier.create(budgetService.updateMonthlyAmount(1L, new BigDecimal("-1")))
                .expectError(BadRequestException.class)
                .verify();
        verifyNoInteractions(bucketRepository);
    }
}
