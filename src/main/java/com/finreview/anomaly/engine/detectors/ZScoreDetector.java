package com.finreview.anomaly.engine.detectors;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.engine.Baseline;
import com.finreview.anomaly.engine.Detector;
import com.finreview.anomaly.exception.DegenerateStatisticException;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parametric detector: flags a period whose amount lies more than
 * {@code threshold} standard deviations from the mean of the other periods.
 *
 * Logic: for period i, baseline = all periods except i (leave-one-out).
 * z = (amount_i - mean) / stdDev. Flag if |z| > threshold (default 3.0).
 *
 * Abstains on the whole series when it is shorter than the minimum window
 * (default 6), and on a single period when its baseline has zero variance,
 * so perfectly flat buckets never produce a flag.
 */
@Component
public class ZScoreDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreDetector.class);

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public DetectorRun evaluate(BucketSeries series, DetectionSettings settings) {
        int n = series.size();
        if (n < settings.getZScoreMinWindow()) {
            return DetectorRun.abstained(getMethod(), DetectorDegradation.of(series.getKey(), getMethod(),
                    DegradationKind.BELOW_MIN_WINDOW, n,
                    String.format("%d periods, Z-score needs at least %d", n, settings.getZScoreMinWindow())));
        }

        double threshold = settings.getZScoreThreshold();
        List<DetectorVerdict> verdicts = new ArrayList<>();
        int degenerate = 0;

        for (int i = 0; i < n; i++) {
            PeriodPoint point = series.point(i);
            Baseline baseline = Baseline.leaveOneOut(series, i);

            double z;
            try {
                z = baseline.standardScore(point.amount());
            } catch (DegenerateStatisticException e) {
                degenerate++;
                continue;
            }

            boolean flagged = Math.abs(z) > threshold;
            double band = threshold * baseline.getStdDev();

            Map<String, Double> stats = new LinkedHashMap<>();
            stats.put("mean", baseline.getMean());
            stats.put("stdDev", baseline.getStdDev());
            stats.put("zScore", z);

            verdicts.add(DetectorVerdict.builder()
                    .method(getMethod())
                    .period(point.period())
                    .observed(point.amount())
                    .flagged(flagged)
                    .score(z)
                    .expected(baseline.getMean())
                    .expectedLow(baseline.getMean() - band)
                    .expectedHigh(baseline.getMean() + band)
                    .statistics(stats)
                    .reason(String.format("Z-score: amount=%.2f, mean=%.2f, stdDev=%.2f, z=%.2f (threshold=%.1f)",
                            point.amount(), baseline.getMean(), baseline.getStdDev(), z, threshold))
                    .build());
        }

        List<DetectorDegradation> degradations = new ArrayList<>();
        if (degenerate > 0) {
            log.debug("Z-score abstained on {} of {} periods of {}: zero baseline variance",
                    degenerate, n, series.getKey().id());
            degradations.add(DetectorDegradation.of(series.getKey(), getMethod(),
                    DegradationKind.DEGENERATE_STATISTIC, degenerate,
                    String.format("standard deviation of baseline is zero for %d of %d periods", degenerate, n)));
        }
        return DetectorRun.of(getMethod(), verdicts, degradations);
    }
}
