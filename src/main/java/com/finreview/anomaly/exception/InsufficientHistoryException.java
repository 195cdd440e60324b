package com.finreview.anomaly.exception;

import com.finreview.anomaly.model.BucketKey;

public class InsufficientHistoryException extends AnomalyDetectionException {

    private final BucketKey bucket;
    private final long nonZeroPeriods;
    private final int requiredPeriods;

    public InsufficientHistoryException(BucketKey bucket, long nonZeroPeriods, int requiredPeriods) {
        super("Bucket " + bucket.id() + " has " + nonZeroPeriods + " non-zero periods, "
                + requiredPeriods + " required");
        this.bucket = bucket;
        this.nonZeroPeriods = nonZeroPeriods;
        this.requiredPeriods = requiredPeriods;
    }

    public BucketKey getBucket() { return bucket; }
    public long getNonZeroPeriods() { return nonZeroPeriods; }
    public int getRequiredPeriods() { return requiredPeriods; }
}
