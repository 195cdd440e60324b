package com.finreview.anomaly.engine;

import com.finreview.anomaly.exception.DegenerateStatisticException;
import com.finreview.anomaly.model.BucketSeries;
import lombok.Value;

/**
 * Leave-one-out history of a bucket: statistics over every period except the
 * one under test, so the tested point never inflates its own baseline.
 */
@Value
public class Baseline {

    int size;
    double mean;
    double stdDev;
    double median;
    double mad;

    public static Baseline leaveOneOut(BucketSeries series, int excludedIndex) {
        return of(SeriesStatistics.excluding(series.amounts(), excludedIndex));
    }

    public static Baseline of(double[] values) {
        double mean = SeriesStatistics.mean(values);
        double median = SeriesStatistics.median(values);
        return new Baseline(values.length, mean,
                SeriesStatistics.sampleStdDev(values, mean),
                median,
                SeriesStatistics.mad(values, median));
    }

    /**
     * @throws DegenerateStatisticException when the baseline has zero variance
     */
    public double standardScore(double value) {
        if (stdDev == 0.0) {
            throw new DegenerateStatisticException("standard deviation of baseline is zero");
        }
        return (value - mean) / stdDev;
    }

    /**
     * Robust z-score using MAD rescaled by {@code scale}.
     *
     * @throws DegenerateStatisticException when the baseline MAD is zero
     */
    public double robustScore(double value, double scale) {
        if (mad == 0.0) {
            throw new DegenerateStatisticException("MAD of baseline is zero");
        }
        return (value - median) / (mad * scale);
    }

    /**
     * Coefficient of variation (std dev / |mean|). Zero for a flat history,
     * infinite for a varying history centred on zero.
     */
    public double coefficientOfVariation() {
        if (stdDev == 0.0) return 0.0;
        if (mean == 0.0) return Double.POSITIVE_INFINITY;
        return stdDev / Math.abs(mean);
    }
}
