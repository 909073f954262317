package com.pennywise_sync.importer;

import reactor.core.publisher.Mono;

/**
 * Collection-specific work run after a record is merged and before its row log is written.
 */
@FunctionalInterface
public interface MergeHook<E> {

    Mono<Void> afterMerge(MergeOutcome<E> outcome);

    static <E> MergeHook<E> none() {
        return outcome -> Mono.empty();
    }
}
