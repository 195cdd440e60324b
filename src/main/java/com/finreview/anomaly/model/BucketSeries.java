package com.finreview.anomaly.model;

import java.time.YearMonth;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chronological per-period series of one bucket, together with the raw rows
 * that produced it. Built once per run by the SeriesBuilder and never mutated.
 */
public final class BucketSeries {

    private final BucketKey key;
    private final String type;
    private final List<PeriodPoint> points;
    private final Map<YearMonth, List<LedgerTransaction>> transactionsByPeriod;

    public BucketSeries(BucketKey key, String type, List<PeriodPoint> points,
                        Map<YearMonth, List<LedgerTransaction>> transactionsByPeriod) {
        this.key = key;
        this.type = type;
        this.points = List.copyOf(points);
        Map<YearMonth, List<LedgerTransaction>> copy = new LinkedHashMap<>();
        transactionsByPeriod.forEach((period, rows) -> copy.put(period, List.copyOf(rows)));
        this.transactionsByPeriod = Collections.unmodifiableMap(copy);
    }

    public BucketKey getKey() { return key; }

    public String getType() { return type; }

    public List<PeriodPoint> getPoints() { return points; }

    public int size() {
        return points.size();
    }

    public PeriodPoint point(int index) {
        return points.get(index);
    }

    public double[] amounts() {
        double[] amounts = new double[points.size()];
        for (int i = 0; i < amounts.length; i++) {
            amounts[i] = points.get(i).amount();
        }
        return amounts;
    }

    public int indexOf(YearMonth period) {
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).period().equals(period)) return i;
        }
        return -1;
    }

    public long nonZeroPeriods() {
        return points.stream().filter(p -> p.amount() != 0.0).count();
    }

    /** Raw rows booked to this bucket in the given period; empty for zero-activity periods. */
    public List<LedgerTransaction> transactionsIn(YearMonth period) {
        return transactionsByPeriod.getOrDefault(period, List.of());
    }

    @Override
    public String toString() {
        return "BucketSeries{" + key.id() + ", periods=" + points.size() + "}";
    }
}
