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
 * Nonparametric detector based on the median absolute deviation.
 *
 * Logic: for period i, baseline = all periods except i.
 * score = (amount_i - median) / (MAD * 1.4826). Flag if |score| > threshold.
 *
 * The 1.4826 factor puts MAD on the same scale as a standard deviation under
 * normality, so the threshold reads the same as the Z-score detector's while
 * the baseline stays unaffected by the outliers being hunted.
 */
@Component
public class RobustDeviationDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(RobustDeviationDetector.class);

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MAD;
    }

    @Override
    public DetectorRun evaluate(BucketSeries series, DetectionSettings settings) {
        int n = series.size();
        if (n < settings.getMadMinWindow()) {
            return DetectorRun.abstained(getMethod(), DetectorDegradation.of(series.getKey(), getMethod(),
                    DegradationKind.BELOW_MIN_WINDOW, n,
                    String.format("%d periods, MAD needs at least %d", n, settings.getMadMinWindow())));
        }

        double threshold = settings.getMadThreshold();
        double scale = settings.getMadScale();
        List<DetectorVerdict> verdicts = new ArrayList<>();
        int degenerate = 0;

        for (int i = 0; i < n; i++) {
            PeriodPoint point = series.point(i);
            Baseline baseline = Baseline.leaveOneOut(series, i);

            double score;
            try {
                score = baseline.robustScore(point.amount(), scale);
            } catch (DegenerateStatisticException e) {
                degenerate++;
                continue;
            }

            double band = threshold * baseline.getMad() * scale;

            Map<String, Double> stats = new LinkedHashMap<>();
            stats.put("median", baseline.getMedian());
            stats.put("mad", baseline.getMad());
            stats.put("robustScore", score);

            verdicts.add(DetectorVerdict.builder()
                    .method(getMethod())
                    .period(point.period())
                    .observed(point.amount())
                    .flagged(Math.abs(score) > threshold)
                    .score(score)
                    .expected(baseline.getMedian())
                    .expectedLow(baseline.getMedian() - band)
                    .expectedHigh(baseline.getMedian() + band)
                    .statistics(stats)
                    .reason(String.format("MAD: amount=%.2f, median=%.2f, MAD=%.2f, robust z=%.2f (threshold=%.1f)",
                            point.amount(), baseline.getMedian(), baseline.getMad(), score, threshold))
                    .build());
        }

        List<DetectorDegradation> degradations = new ArrayList<>();
        if (degenerate > 0) {
            log.debug("MAD abstained on {} of {} periods of {}: zero baseline MAD",
                    degenerate, n, series.getKey().id());
            degradations.add(DetectorDegradation.of(series.getKey(), getMethod(),
                    DegradationKind.DEGENERATE_STATISTIC, degenerate,
                    String.format("MAD of baseline is zero for %d of %d periods", degenerate, n)));
        }
        return DetectorRun.of(getMethod(), verdicts, degradations);
    }
}
