package com.finreview.anomaly.engine;

import java.util.Arrays;

/**
 * Plain descriptive statistics over amount arrays.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Sample standard deviation (n - 1 denominator); 0 for fewer than two values. */
    public static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) return 0.0;
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / (values.length - 1));
    }

    public static double median(double[] values) {
        if (values.length == 0) return 0.0;
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) return sorted[mid];
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Median absolute deviation around the given median (unscaled). */
    public static double mad(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /** Copy of {@code values} without the element at {@code index}. */
    public static double[] excluding(double[] values, int index) {
        double[] out = new double[values.length - 1];
        System.arraycopy(values, 0, out, 0, index);
        System.arraycopy(values, index + 1, out, index, values.length - index - 1);
        return out;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
