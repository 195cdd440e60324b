package com.finreview.anomaly.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    private ZScore zscore = new ZScore();
    private Mad mad = new Mad();
    private Isolation isolation = new Isolation();
    private Series series = new Series();
    private SeverityBreakpoints severity = new SeverityBreakpoints();
    private ConfidenceBreakpoints confidence = new ConfidenceBreakpoints();
    private Attribution attribution = new Attribution();
    private Execution execution = new Execution();

    // A bad application.yml must abort startup, not the first run.
    @PostConstruct
    void validateOnStartup() {
        toSettings();
    }

    /**
     * Snapshot the current values into an immutable, validated settings object.
     */
    public DetectionSettings toSettings() {
        return DetectionSettings.builder()
                .zScoreThreshold(zscore.getThreshold())
                .zScoreMinWindow(zscore.getMinWindow())
                .madThreshold(mad.getThreshold())
                .madScale(mad.getScale())
                .madMinWindow(mad.getMinWindow())
                .isolationEnabled(isolation.isEnabled())
                .isolationContamination(isolation.getContamination())
                .isolationMinPeriods(isolation.getMinPeriods())
                .isolationNumTrees(isolation.getNumTrees())
                .isolationSampleSize(isolation.getSampleSize())
                .isolationBaseSeed(isolation.getBaseSeed())
                .isolationMinAnomalyScore(isolation.getMinAnomalyScore())
                .minNonZeroPeriods(series.getMinNonZeroPeriods())
                .entityPartitioning(series.isEntityPartitioning())
                .fillCalendarGaps(series.isFillCalendarGaps())
                .severityHighPct(severity.getHighPct())
                .severityMediumPct(severity.getMediumPct())
                .severityHighVolatilityMultiplier(severity.getHighVolatilityMultiplier())
                .severityMultiDetectorMediumPct(severity.getMultiDetectorMediumPct())
                .severityMultiDetectorCount(severity.getMultiDetectorCount())
                .confidenceTwoDetectorHighNormalized(confidence.getTwoDetectorHighNormalized())
                .confidenceOneDetectorMediumNormalized(confidence.getOneDetectorMediumNormalized())
                .maxContributors(attribution.getMaxContributors())
                .otherLabel(attribution.getOtherLabel())
                .unassignedLabel(attribution.getUnassignedLabel())
                .parallel(execution.isParallel())
                .maxWorkers(execution.getMaxWorkers())
                .build()
                .validate();
    }

    /** Write a validated settings snapshot back into the live configuration. */
    public void apply(DetectionSettings settings) {
        zscore.setThreshold(settings.getZScoreThreshold());
        zscore.setMinWindow(settings.getZScoreMinWindow());
        mad.setThreshold(settings.getMadThreshold());
        mad.setMinWindow(settings.getMadMinWindow());
        isolation.setEnabled(settings.isIsolationEnabled());
        isolation.setContamination(settings.getIsolationContamination());
        isolation.setMinPeriods(settings.getIsolationMinPeriods());
        series.setMinNonZeroPeriods(settings.getMinNonZeroPeriods());
        attribution.setMaxContributors(settings.getMaxContributors());
    }

    @Data
    public static class ZScore {
        private double threshold = 3.0;
        private int minWindow = 6;
    }

    @Data
    public static class Mad {
        private double threshold = 3.0;
        private double scale = 1.4826;
        private int minWindow = 6;
    }

    @Data
    public static class Isolation {
        private boolean enabled = true;
        // Fraction of periods expected to be anomalous (top 10% most isolated)
        private double contamination = 0.10;
        private int minPeriods = 8;
        private int numTrees = 100;
        private int sampleSize = 256;
        private long baseSeed = 42L;
        // Scores at or below 0.5 are not distinguishable from the rest of the series
        private double minAnomalyScore = 0.5;
    }

    @Data
    public static class Series {
        private int minNonZeroPeriods = 3;
        private boolean entityPartitioning = false;
        private boolean fillCalendarGaps = true;
    }

    @Data
    public static class SeverityBreakpoints {
        private double highPct = 50.0;
        private double mediumPct = 25.0;
        private double highVolatilityMultiplier = 2.0;
        private double multiDetectorMediumPct = 10.0;
        private int multiDetectorCount = 2;
    }

    @Data
    public static class ConfidenceBreakpoints {
        private double twoDetectorHighNormalized = 3.0;
        private double oneDetectorMediumNormalized = 4.0;
    }

    @Data
    public static class Attribution {
        private int maxContributors = 5;
        private String otherLabel = "Other";
        private String unassignedLabel = "(unassigned)";
    }

    @Data
    public static class Execution {
        private boolean parallel = true;
        private int maxWorkers = 4;
    }
}
