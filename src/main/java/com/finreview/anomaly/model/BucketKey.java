package com.finreview.anomaly.model;

import java.util.Comparator;

/**
 * Identity of a bucket series: the bucket name plus the entity when entity
 * partitioning is active (null otherwise).
 */
public record BucketKey(String bucket, String entity) implements Comparable<BucketKey> {

    private static final Comparator<BucketKey> ORDER = Comparator
            .comparing(BucketKey::bucket)
            .thenComparing(BucketKey::entity, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static BucketKey of(String bucket) {
        return new BucketKey(bucket, null);
    }

    /** Stable textual id, also the input of the isolation-forest seed. */
    public String id() {
        return entity == null ? bucket : bucket + "@" + entity;
    }

    @Override
    public int compareTo(BucketKey other) {
        return ORDER.compare(this, other);
    }
}
