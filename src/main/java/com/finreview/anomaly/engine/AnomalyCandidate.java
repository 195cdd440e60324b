package com.finreview.anomaly.engine;

import com.finreview.anomaly.model.BucketKey;
import com.finreview.anomaly.model.DetectionMethod;
import com.finreview.anomaly.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.List;

/**
 * Reconciled flag for one bucket-period, before attribution and confidence.
 */
@Value
@Builder
public class AnomalyCandidate {
    BucketKey key;
    String type;
    YearMonth period;
    double observed;
    double expected;
    Double expectedLow;
    Double expectedHigh;
    double deviation;
    double pctDeviation;
    /** Coefficient of variation of the leave-one-out history. */
    double volatility;
    /** |deviation| / std dev of the leave-one-out history; infinite for a flat history. */
    double normalizedDeviation;
    Severity severity;
    List<DetectionMethod> methods;
}
