package com.pennywise_sync.service;

import com.pennywise_sync.config.BudgetProperties;
import com.pennywise_sync.model.Bucket;
import com.pennywise_sync.repository.BucketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Locates the catch-all bucket that receives distribution remainders and funds resets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OthersBucketResolver {

    private final BucketRepository bucketRepository;
    private final BudgetProperties properties;

    public String name() {
        return properties.getOthersBucketName();
    }

    /** Empty if the bucket has not been created yet. */
    public Mono<Bucket> find() {
        return bucketRepository.findByName(name());
    }

    /** Finds the bucket, creating it with no monthly amount on first use. */
    public Mono<Bucket> resolve() {
        return find().switchIfEmpty(Mono.defer(() -> {
            log.info("Creating '{}' bucket", name());
            return bucketRepository.save(Bucket.named(name(), null));
        }));
    }
}
