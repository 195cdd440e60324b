package com.finreview.anomaly.config;

import com.finreview.anomaly.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of every tunable used by one analysis run. Components
 * receive it explicitly per call, so runs with different settings can execute
 * side by side.
 */
@Value
@Builder(toBuilder = true)
public class DetectionSettings {

    // Z-score detector
    @Builder.Default double zScoreThreshold = 3.0;
    @Builder.Default int zScoreMinWindow = 6;

    // MAD detector; 1.4826 rescales MAD to a standard deviation under normality
    @Builder.Default double madThreshold = 3.0;
    @Builder.Default double madScale = 1.4826;
    @Builder.Default int madMinWindow = 6;

    // Isolation forest detector
    @Builder.Default boolean isolationEnabled = true;
    @Builder.Default double isolationContamination = 0.10;
    @Builder.Default int isolationMinPeriods = 8;
    @Builder.Default int isolationNumTrees = 100;
    @Builder.Default int isolationSampleSize = 256;
    @Builder.Default long isolationBaseSeed = 42L;
    @Builder.Default double isolationMinAnomalyScore = 0.5;

    // Series building
    @Builder.Default int minNonZeroPeriods = 3;
    @Builder.Default boolean entityPartitioning = false;
    @Builder.Default boolean fillCalendarGaps = true;

    // Severity breakpoints (percent deviation, volatility multiple)
    @Builder.Default double severityHighPct = 50.0;
    @Builder.Default double severityMediumPct = 25.0;
    @Builder.Default double severityHighVolatilityMultiplier = 2.0;
    @Builder.Default double severityMultiDetectorMediumPct = 10.0;
    @Builder.Default int severityMultiDetectorCount = 2;

    // Confidence breakpoints (deviation / historical std dev)
    @Builder.Default double confidenceTwoDetectorHighNormalized = 3.0;
    @Builder.Default double confidenceOneDetectorMediumNormalized = 4.0;

    // Attribution
    @Builder.Default int maxContributors = 5;
    @Builder.Default String otherLabel = "Other";
    @Builder.Default String unassignedLabel = "(unassigned)";

    // Execution
    @Builder.Default boolean parallel = true;
    @Builder.Default int maxWorkers = 4;

    public static DetectionSettings defaults() {
        return DetectionSettings.builder().build();
    }

    /**
     * @return this instance
     * @throws ConfigurationException on the first out-of-range value
     */
    public DetectionSettings validate() {
        positive("zscore.threshold", zScoreThreshold);
        atLeast("zscore.min-window", zScoreMinWindow, 3);
        positive("mad.threshold", madThreshold);
        positive("mad.scale", madScale);
        atLeast("mad.min-window", madMinWindow, 3);
        if (!(isolationContamination > 0 && isolationContamination <= 0.5)) {
            throw new ConfigurationException("isolation.contamination", "must be in (0, 0.5], got " + isolationContamination);
        }
        atLeast("isolation.min-periods", isolationMinPeriods, 2);
        atLeast("isolation.num-trees", isolationNumTrees, 1);
        atLeast("isolation.sample-size", isolationSampleSize, 2);
        if (!(isolationMinAnomalyScore >= 0 && isolationMinAnomalyScore < 1)) {
            throw new ConfigurationException("isolation.min-anomaly-score", "must be in [0, 1), got " + isolationMinAnomalyScore);
        }
        atLeast("series.min-non-zero-periods", minNonZeroPeriods, 1);
        nonNegative("severity.high-pct", severityHighPct);
        nonNegative("severity.medium-pct", severityMediumPct);
        if (severityMediumPct > severityHighPct) {
            throw new ConfigurationException("severity.medium-pct", "must not exceed severity.high-pct");
        }
        nonNegative("severity.high-volatility-multiplier", severityHighVolatilityMultiplier);
        nonNegative("severity.multi-detector-medium-pct", severityMultiDetectorMediumPct);
        if (severityMultiDetectorCount < 1 || severityMultiDetectorCount > 3) {
            throw new ConfigurationException("severity.multi-detector-count", "must be between 1 and 3, got " + severityMultiDetectorCount);
        }
        nonNegative("confidence.two-detector-high-normalized", confidenceTwoDetectorHighNormalized);
        nonNegative("confidence.one-detector-medium-normalized", confidenceOneDetectorMediumNormalized);
        atLeast("attribution.max-contributors", maxContributors, 1);
        if (otherLabel == null || otherLabel.isBlank()) {
            throw new ConfigurationException("attribution.other-label", "must not be blank");
        }
        if (unassignedLabel == null || unassignedLabel.isBlank()) {
            throw new ConfigurationException("attribution.unassigned-label", "must not be blank");
        }
        atLeast("execution.max-workers", maxWorkers, 1);
        return this;
    }

    private static void positive(String field, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(field, "must be > 0, got " + value);
        }
    }

    private static void nonNegative(String field, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(field, "must be >= 0, got " + value);
        }
    }

    private static void atLeast(String field, long value, long min) {
        if (value < min) {
            throw new ConfigurationException(field, "must be >= " + min + ", got " + value);
        }
    }
}
