package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.DetectionMethod;
import com.finreview.anomaly.model.DetectorRun;
import com.finreview.anomaly.model.DetectorVerdict;
import com.finreview.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the detectors' independent verdicts into one candidate per
 * bucket-period.
 *
 * A period becomes a candidate when at least one non-abstaining detector flags
 * it (union). All flagging detectors collapse into a single candidate that
 * lists every agreeing method and keeps the largest deviation among them.
 *
 * Severity depends only on the percentage deviation, the bucket's historical
 * volatility and the number of agreeing detectors:
 *   HIGH:   |pct| >= 50 and |pct|/100 > 2 x coefficient of variation
 *   MEDIUM: |pct| >= 25, or 2+ detectors agree and |pct| >= 10
 *   LOW:    any other flagged period
 */
@Component
public class EnsembleReconciler {

    public List<AnomalyCandidate> reconcile(BucketSeries series, List<DetectorRun> runs, DetectionSettings settings) {
        Map<YearMonth, List<DetectorVerdict>> flaggedByPeriod = new TreeMap<>();
        for (DetectorRun run : runs) {
            for (DetectorVerdict verdict : run.getVerdicts()) {
                if (verdict.isFlagged()) {
                    flaggedByPeriod.computeIfAbsent(verdict.getPeriod(), p -> new ArrayList<>()).add(verdict);
                }
            }
        }

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (Map.Entry<YearMonth, List<DetectorVerdict>> entry : flaggedByPeriod.entrySet()) {
            int index = series.indexOf(entry.getKey());
            if (index < 0) continue;
            candidates.add(merge(series, index, entry.getValue(), settings));
        }
        return candidates;
    }

    private AnomalyCandidate merge(BucketSeries series, int index, List<DetectorVerdict> flagged,
                                   DetectionSettings settings) {
        // Strongest signal wins; ties resolved by method order for determinism
        DetectorVerdict strongest = flagged.stream()
                .max(Comparator.comparingDouble((DetectorVerdict v) -> Math.abs(v.deviation()))
                        .thenComparing(v -> v.getMethod(), Comparator.reverseOrder()))
                .orElseThrow();

        List<DetectionMethod> methods = flagged.stream()
                .map(DetectorVerdict::getMethod)
                .distinct()
                .sorted()
                .toList();

        double observed = series.point(index).amount();
        double expected = strongest.getExpected();
        double deviation = observed - expected;
        double pct = expected != 0.0 ? deviation / Math.abs(expected) * 100.0 : 0.0;

        Baseline history = Baseline.leaveOneOut(series, index);
        double volatility = history.coefficientOfVariation();
        double normalized = normalizedDeviation(deviation, history.getStdDev());

        return AnomalyCandidate.builder()
                .key(series.getKey())
                .type(series.getType())
                .period(series.point(index).period())
                .observed(observed)
                .expected(expected)
                .expectedLow(strongest.getExpectedLow())
                .expectedHigh(strongest.getExpectedHigh())
                .deviation(deviation)
                .pctDeviation(pct)
                .volatility(volatility)
                .normalizedDeviation(normalized)
                .severity(classifySeverity(pct, volatility, methods.size(), settings))
                .methods(methods)
                .build();
    }

    public static Severity classifySeverity(double pctDeviation, double volatility, int agreeingDetectors,
                                            DetectionSettings settings) {
        double absPct = Math.abs(pctDeviation);
        if (absPct >= settings.getSeverityHighPct()
                && absPct / 100.0 > settings.getSeverityHighVolatilityMultiplier() * volatility) {
            return Severity.HIGH;
        }
        if (absPct >= settings.getSeverityMediumPct()
                || (agreeingDetectors >= settings.getSeverityMultiDetectorCount()
                    && absPct >= settings.getSeverityMultiDetectorMediumPct())) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    static double normalizedDeviation(double deviation, double historicalStdDev) {
        if (historicalStdDev == 0.0) {
            return deviation == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs(deviation) / historicalStdDev;
    }
}
