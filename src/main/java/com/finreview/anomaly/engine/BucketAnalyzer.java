package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.config.MetricsConfig;
import com.finreview.anomaly.model.AnomalyRecord;
import com.finreview.anomaly.model.BucketAnalysis;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.Confidence;
import com.finreview.anomaly.model.Contributor;
import com.finreview.anomaly.model.DegradationKind;
import com.finreview.anomaly.model.DetectionMethod;
import com.finreview.anomaly.model.DetectorDegradation;
import com.finreview.anomaly.model.DetectorRun;
import com.finreview.anomaly.model.DetectorVerdict;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole per-bucket pipeline: every enabled detector, then
 * reconciliation, attribution and confidence scoring.
 *
 * A detector that throws is recorded as a degradation and the remaining
 * detectors still run, so one failing method never hides the findings of the
 * others. Holds no state between calls; safe to use from several workers.
 */
@Component
public class BucketAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BucketAnalyzer.class);

    private final Map<DetectionMethod, Detector> detectors;
    private final EnsembleReconciler reconciler;
    private final AttributionEngine attributionEngine;
    private final ConfidenceScorer confidenceScorer;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public BucketAnalyzer(List<Detector> detectors, EnsembleReconciler reconciler,
                          AttributionEngine attributionEngine, ConfidenceScorer confidenceScorer,
                          Tracer tracer, MetricsConfig metricsConfig) {
        this.detectors = new EnumMap<>(DetectionMethod.class);
        this.reconciler = reconciler;
        this.attributionEngine = attributionEngine;
        this.confidenceScorer = confidenceScorer;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (Detector detector : detectors) {
            this.detectors.put(detector.getMethod(), detector);
            log.info("Registered detector: {} -> {}", detector.getMethod(), detector.getClass().getSimpleName());
        }
    }

    @Observed(name = "bucket.analyze", contextualName = "analyze-bucket")
    public BucketAnalysis analyze(BucketSeries series, DetectionSettings settings) {
        List<DetectorRun> runs = new ArrayList<>();
        List<DetectorDegradation> degradations = new ArrayList<>();

        for (Detector detector : detectors.values()) {
            if (!detector.isEnabled(settings)) {
                continue;
            }
            DetectorRun run = runDetector(detector, series, settings);
            runs.add(run);
            degradations.addAll(run.getDegradations());
            run.getDegradations().forEach(d ->
                    metricsConfig.recordDetectorDegraded(d.getMethod().getWireName(), d.getKind().name()));
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (AnomalyCandidate candidate : reconciler.reconcile(series, runs, settings)) {
            List<Contributor> contributors = attributionEngine.attribute(series, candidate.getPeriod(),
                    candidate.getDeviation(), settings);
            Confidence confidence = confidenceScorer.score(candidate.getMethods().size(),
                    candidate.getNormalizedDeviation(), settings);
            AnomalyRecord record = toRecord(candidate, confidence, contributors);
            anomalies.add(record);
            metricsConfig.recordAnomaly(record.getSeverity().getWireName());
            log.debug("Anomaly in {} {}: severity={}, confidence={}, methods={}",
                    series.getKey().id(), candidate.getPeriod(), record.getSeverity(), confidence,
                    candidate.getMethods());
        }

        return new BucketAnalysis(series.getKey(), anomalies, degradations);
    }

    private DetectorRun runDetector(Detector detector, BucketSeries series, DetectionSettings settings) {
        DetectionMethod method = detector.getMethod();
        Span span = tracer.nextSpan()
                .name("detector.evaluate." + method.getWireName())
                .tag("bucket", series.getKey().id())
                .tag("periods", String.valueOf(series.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            DetectorRun run = detector.evaluate(series, settings);
            int flagged = (int) run.getVerdicts().stream().filter(DetectorVerdict::isFlagged).count();
            span.tag("detector.flagged", String.valueOf(flagged));
            span.tag("detector.abstained", String.valueOf(run.isAbstained()));
            if (flagged > 0) {
                metricsConfig.recordDetectorFlagged(method.getWireName(), flagged);
            }
            return run;
        } catch (Exception e) {
            span.error(e);
            log.error("Detector {} failed on bucket {}: {}", method, series.getKey().id(), e.getMessage(), e);
            DegradationKind kind = method == DetectionMethod.ISOLATION_FOREST
                    ? DegradationKind.MODEL_FIT_FAILURE : DegradationKind.DETECTOR_ERROR;
            return DetectorRun.abstained(method, DetectorDegradation.of(series.getKey(), method, kind,
                    series.size(), e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            span.end();
        }
    }

    private static AnomalyRecord toRecord(AnomalyCandidate candidate, Confidence confidence,
                                          List<Contributor> contributors) {
        return AnomalyRecord.builder()
                .bucket(candidate.getKey().bucket())
                .entity(candidate.getKey().entity())
                .type(candidate.getType())
                .period(candidate.getPeriod())
                .observedAmount(SeriesStatistics.round(candidate.getObserved(), 2))
                .expectedAmount(SeriesStatistics.round(candidate.getExpected(), 2))
                .expectedLow(roundOrNull(candidate.getExpectedLow()))
                .expectedHigh(roundOrNull(candidate.getExpectedHigh()))
                .deviation(SeriesStatistics.round(candidate.getDeviation(), 2))
                .pctDeviation(SeriesStatistics.round(candidate.getPctDeviation(), 2))
                .historicalVolatility(finiteOrNull(candidate.getVolatility(), 4))
                .normalizedDeviation(finiteOrNull(candidate.getNormalizedDeviation(), 2))
                .severity(candidate.getSeverity())
                .confidence(confidence)
                .methods(candidate.getMethods())
                .contributors(List.copyOf(contributors))
                .explanation(explain(candidate, contributors))
                .build();
    }

    /**
     * One-line summary, e.g. "400.0% increase vs expected in OPEX - Marketing.
     * Top contributor: ACME Media Ltd (60.0% of deviation)".
     */
    static String explain(AnomalyCandidate candidate, List<Contributor> contributors) {
        String direction = candidate.getDeviation() >= 0 ? "increase" : "decrease";
        StringBuilder sb = new StringBuilder(String.format("%.1f%% %s vs expected in %s",
                Math.abs(candidate.getPctDeviation()), direction, candidate.getKey().id()));
        contributors.stream()
                .filter(c -> !c.isUnattributed())
                .findFirst()
                .ifPresent(top -> sb.append(String.format(". Top contributor: %s (%.1f%% of deviation)",
                        top.getName(), top.getShare())));
        return sb.toString();
    }

    private static Double roundOrNull(Double value) {
        return value == null ? null : SeriesStatistics.round(value, 2);
    }

    private static Double finiteOrNull(double value, int decimals) {
        return Double.isFinite(value) ? SeriesStatistics.round(value, decimals) : null;
    }
}
