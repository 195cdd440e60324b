package com.finreview.anomaly.engine.isolationforest;

import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.PeriodPoint;

/**
 * Builds one 4-dimensional feature row per period of a bucket series.
 *
 * Features:
 *   [0] Amount: the period's aggregated amount
 *   [1] Transaction count: rows booked in the period
 *   [2] Period delta: amount - previous period's amount (0 for the first period)
 *   [3] Rolling average: mean amount of the period and up to two preceding periods
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 4;

    public static final String[] FEATURE_NAMES = {
            "Amount",
            "Transaction Count",
            "Period Delta",
            "Rolling-3 Average"
    };

    private FeatureExtractor() {}

    public static double[][] extract(BucketSeries series) {
        int n = series.size();
        double[][] features = new double[n][FEATURE_COUNT];

        for (int i = 0; i < n; i++) {
            PeriodPoint point = series.point(i);

            features[i][0] = point.amount();
            features[i][1] = point.transactionCount();
            features[i][2] = i == 0 ? 0.0 : point.amount() - series.point(i - 1).amount();

            int from = Math.max(0, i - 2);
            double sum = 0.0;
            for (int j = from; j <= i; j++) {
                sum += series.point(j).amount();
            }
            features[i][3] = sum / (i - from + 1);
        }
        return features;
    }

    /** Column means, used as the "typical" point for feature contributions. */
    public static double[] columnMeans(double[][] data) {
        double[] means = new double[FEATURE_COUNT];
        for (double[] row : data) {
            for (int f = 0; f < FEATURE_COUNT; f++) {
                means[f] += row[f];
            }
        }
        for (int f = 0; f < FEATURE_COUNT; f++) {
            means[f] /= data.length;
        }
        return means;
    }

    /** True when at least one feature takes more than one distinct value. */
    public static boolean hasSpread(double[][] data) {
        if (data.length < 2) return false;
        for (int f = 0; f < data[0].length; f++) {
            double first = data[0][f];
            for (double[] row : data) {
                if (row[f] != first) return true;
            }
        }
        return false;
    }
}
