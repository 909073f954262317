package com.pennywise_sync.ledger;

import com.pennywise_sync.exception.InternalException;
import com.pennywise_sync.model.Bucket;
import com.pennywise_sync.repository.BucketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * The only place bucket balances change. Callers run inside a store transaction and
 * write the audit row that explains the delta in that same transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BalanceLedger {

    private final BucketRepository bucketRepository;

    /**
     * balance += signedAmount, in one UPDATE statement.
     */
    public Mono<Void> applyDelta(Long bucketId, BigDecimal signedAmount) {
        return bucketRepository.addToBalance(bucketId, signedAmount)
                .flatMap(rows -> {
                    if (rows == 0) {
                        return Mono.<Void>error(new InternalException(
                                "Bucket " + bucketId + " disappeared while applying " + signedAmount));
                    }
                    log.debug("Bucket {} balance += {}", bucketId, signedAmount);
                    return Mono.<Void>empty();
                });
    }

    /**
     * Reads a bucket and keeps its row locked until the transaction ends. Empty if absent.
     */
    public Mono<Bucket> lock(Long bucketId) {
        return bucketRepository.findByIdForUpdate(bucketId);
    }
}
