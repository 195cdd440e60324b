package com.finreview.anomaly.engine.detectors;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.engine.Detector;
import com.finreview.anomaly.engine.SeriesStatistics;
import com.finreview.anomaly.engine.isolationforest.FeatureExtractor;
import com.finreview.anomaly.engine.isolationforest.IsolationForest;
import com.finreview.anomaly.exception.ModelFitException;
import com.finreview.anomaly.model.BucketKey;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.DegradationKind;
import com.finreview.anomaly.model.DetectionMethod;
import com.finreview.anomaly.model.DetectorDegradation;
import com.finreview.anomaly.model.DetectorRun;
import com.finreview.anomaly.model.DetectorVerdict;
import com.finreview.anomaly.model.PeriodPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags periods whose joint behavior is rare for the bucket, using an
 * Isolation Forest fitted on the bucket's whole history.
 *
 * The model sees [amount, transaction count, period delta, rolling-3 average]
 * per period, so it catches combinations the amount-only detectors miss, e.g.
 * a normal total booked through unusually few rows.
 *
 * Flagging:
 *   Every period is scored, including the ones used for fitting. At most
 *   floor(n * contamination) periods (at least one) are flagged: those ranked
 *   in that top slice whose score is strictly above the next-ranked score and
 *   above the minimum anomaly score (see {@link #isFlagged}). Ties at the cut are never flagged, so a
 *   series of identical periods yields nothing.
 *
 * The forest seed is derived from the bucket id, so results do not depend on
 * which worker thread evaluates the bucket or in what order.
 */
@Component
public class IsolationDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(IsolationDetector.class);

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ISOLATION_FOREST;
    }

    @Override
    public boolean isEnabled(DetectionSettings settings) {
        return settings.isIsolationEnabled();
    }

    @Override
    public DetectorRun evaluate(BucketSeries series, DetectionSettings settings) {
        BucketKey key = series.getKey();
        int n = series.size();
        if (n < settings.getIsolationMinPeriods()) {
            return DetectorRun.abstained(getMethod(), DetectorDegradation.of(key, getMethod(),
                    DegradationKind.BELOW_MIN_WINDOW, n,
                    String.format("%d periods, Isolation Forest needs at least %d", n, settings.getIsolationMinPeriods())));
        }

        double[][] features = FeatureExtractor.extract(series);
        if (!FeatureExtractor.hasSpread(features)) {
            log.debug("Isolation Forest abstained on {}: no feature varies across periods", key.id());
            return DetectorRun.abstained(getMethod(), DetectorDegradation.of(key, getMethod(),
                    DegradationKind.DEGENERATE_STATISTIC, n, "no feature varies across periods"));
        }

        IsolationForest forest;
        try {
            forest = IsolationForest.train(features, settings.getIsolationNumTrees(),
                    settings.getIsolationSampleSize(), seedFor(key, settings));
        } catch (ModelFitException e) {
            log.warn("Isolation Forest fit failed for {}: {}", key.id(), e.getMessage());
            return DetectorRun.abstained(getMethod(), DetectorDegradation.of(key, getMethod(),
                    DegradationKind.MODEL_FIT_FAILURE, n, e.getMessage()));
        }

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = forest.anomalyScore(features[i]);
        }

        double cutoff = cutoffScore(scores, settings.getIsolationContamination());
        double minScore = settings.getIsolationMinAnomalyScore();
        boolean[] flagged = new boolean[n];
        List<Double> normalAmounts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            flagged[i] = isFlagged(scores[i], cutoff, minScore);
            if (!flagged[i]) normalAmounts.add(series.point(i).amount());
        }

        // Expected value: median of the periods the model considers normal
        double expected = SeriesStatistics.median(normalAmounts.stream().mapToDouble(Double::doubleValue).toArray());
        double[] featureMeans = FeatureExtractor.columnMeans(features);

        List<DetectorVerdict> verdicts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            PeriodPoint point = series.point(i);

            Map<String, Double> stats = new LinkedHashMap<>();
            stats.put("anomalyScore", scores[i]);
            stats.put("cutoffScore", cutoff);

            String reason = flagged[i]
                    ? buildReason(scores[i], cutoff, features[i], forest.featureContributions(features[i], featureMeans))
                    : String.format("Isolation Forest: score=%.3f (cutoff=%.3f). Within normal range.", scores[i], cutoff);

            verdicts.add(DetectorVerdict.builder()
                    .method(getMethod())
                    .period(point.period())
                    .observed(point.amount())
                    .flagged(flagged[i])
                    .score(scores[i])
                    .expected(expected)
                    .statistics(stats)
                    .reason(reason)
                    .build());
        }
        return DetectorRun.of(getMethod(), verdicts, List.of());
    }

    static long seedFor(BucketKey key, DetectionSettings settings) {
        return settings.getIsolationBaseSeed() * 31L + key.id().hashCode();
    }

    /**
     * A period is flagged when it is in the top contamination slice and its score
     * also clears the floor.
     *
     * The slice alone always holds k periods, even on a series with no outlier at
     * all; the floor keeps those ordinary periods out. Isolation Forest scores at or
     * below 0.5 mean the point took an average-length path to isolate, i.e. it is
     * not distinguishable from the rest, hence the 0.5 default. A floor of 0 leaves
     * the plain top-slice rule.
     */
    static boolean isFlagged(double score, double cutoff, double minAnomalyScore) {
        return score > cutoff && score > minAnomalyScore;
    }

    /**
     * Score a period must strictly exceed to be in the top contamination slice:
     * the (k+1)-th highest score, k = max(1, floor(n * contamination)).
     */
    static double cutoffScore(double[] scores, double contamination) {
        double[] sorted = Arrays.copyOf(scores, scores.length);
        Arrays.sort(sorted);
        int k = Math.max(1, (int) Math.floor(scores.length * contamination));
        int idx = sorted.length - 1 - k;
        return idx >= 0 ? sorted[idx] : Double.NEGATIVE_INFINITY;
    }

    private String buildReason(double score, double cutoff, double[] features, double[] contributions) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Isolation Forest: score=%.3f (cutoff=%.3f). Top factors: ", score, cutoff));

        Integer[] order = new Integer[contributions.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(contributions[b], contributions[a]));

        int shown = 0;
        for (int idx : order) {
            if (shown == 2 || contributions[idx] <= 0) break;
            if (shown > 0) sb.append(", ");
            sb.append(String.format("%s=%.2f (contribution=%.3f)",
                    FeatureExtractor.FEATURE_NAMES[idx], features[idx], contributions[idx]));
            shown++;
        }
        if (shown == 0) sb.append("none dominant");
        return sb.toString();
    }
}
