package com.pennywise_sync.importer;

import com.pennywise_sync.model.Bucket;
import com.pennywise_sync.model.BucketLink;
import com.pennywise_sync.model.Category;
import com.pennywise_sync.model.RowAction;
import com.pennywise_sync.repository.BucketRepository;
import com.pennywise_sync.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Keeps every category owned by a bucket. A category gets a bucket of the same name
 * when it is first imported; an existing bucket with that name is reused.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryBuckets implements MergeHook<Category> {

    private final CategoryRepository categoryRepository;
    private final BucketRepository bucketRepository;

    @Override
    public Mono<Void> afterMerge(MergeOutcome<Category> outcome) {
        // Updated categories keep whatever link they already have
        if (outcome.action() != RowAction.ADDED) {
            return Mono.empty();
        }
        return link(outcome.entity()).then();
    }

    /**
     * Bucket owning the named category, linking one first if the category has none.
     * Empty when no category carries that name.
     */
    public Mono<Long> bucketFor(String categoryName) {
        if (categoryName == null) {
            return Mono.empty();
        }
        return categoryRepository.findByName(categoryName)
                .flatMap(category -> {
                    BucketLink link = category.link();
                    if (link instanceof BucketLink.Linked linked) {
                        return Mono.just(linked.bucketId());
                    }
                    return link(category);
                });
    }

    private Mono<Long> link(Category category) {
        return bucketRepository.findByName(category.getName())
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("Creating bucket for category '{}'", category.getName());
                    return bucketRepository.save(Bucket.named(category.getName(), null));
                }))
                .flatMap(bucket -> {
                    category.setBucketId(bucket.getId());
                    return categoryRepository.save(category).thenReturn(bucket.getId());
                });
    }
}
