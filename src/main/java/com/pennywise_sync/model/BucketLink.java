package com.pennywise_sync.model;

/**
 * Ownership state of a category. A category is {@link Unlinked} only between its
 * insertion and the moment a bucket is assigned to it.
 */
public sealed interface BucketLink permits BucketLink.Unlinked, BucketLink.Linked {

    Unlinked UNLINKED = new Unlinked();

    static BucketLink of(Long bucketId) {
        return bucketId == null ? UNLINKED : new Linked(bucketId);
    }

    record Unlinked() implements BucketLink {}

    record Linked(long bucketId) implements BucketLink {}
}
