package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.exception.InsufficientHistoryException;
import com.finreview.anomaly.model.BucketKey;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.ExcludedBucket;
import com.finreview.anomaly.model.LedgerTransaction;
import com.finreview.anomaly.model.PeriodPoint;
import com.finreview.anomaly.model.SeriesBuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregates normalized ledger rows into one chronological series per bucket
 * (per bucket and entity when entity partitioning is on).
 *
 * Every series spans the same reporting calendar; months without activity are
 * present with amount 0 so they count towards variance. Buckets with too few
 * active months are excluded and reported, never dropped silently.
 */
@Component
public class SeriesBuilder {

    private static final Logger log = LoggerFactory.getLogger(SeriesBuilder.class);

    public SeriesBuildResult build(List<LedgerTransaction> rows, DetectionSettings settings) {
        Map<BucketKey, List<LedgerTransaction>> byBucket = new TreeMap<>();
        TreeSet<YearMonth> periods = new TreeSet<>();
        int dropped = 0;

        for (LedgerTransaction row : rows) {
            if (row == null || row.getBucket() == null || row.getBucket().isBlank() || row.getPeriod() == null) {
                dropped++;
                continue;
            }
            BucketKey key = new BucketKey(row.getBucket(),
                    settings.isEntityPartitioning() ? row.getEntity() : null);
            byBucket.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            periods.add(row.getPeriod());
        }
        if (dropped > 0) {
            log.warn("Dropped {} ledger rows without bucket or period", dropped);
        }

        List<YearMonth> calendar = calendar(periods, settings.isFillCalendarGaps());
        List<BucketSeries> series = new ArrayList<>();
        List<ExcludedBucket> excluded = new ArrayList<>();

        for (Map.Entry<BucketKey, List<LedgerTransaction>> entry : byBucket.entrySet()) {
            try {
                series.add(buildSeries(entry.getKey(), entry.getValue(), calendar, settings.getMinNonZeroPeriods()));
            } catch (InsufficientHistoryException e) {
                log.warn("Excluding bucket {} from detection: {}", entry.getKey().id(), e.getMessage());
                excluded.add(ExcludedBucket.builder()
                        .bucket(e.getBucket().bucket())
                        .entity(e.getBucket().entity())
                        .nonZeroPeriods(e.getNonZeroPeriods())
                        .requiredPeriods(e.getRequiredPeriods())
                        .reason("insufficient history")
                        .build());
            }
        }

        log.info("Built {} bucket series over {} periods ({} excluded for insufficient history)",
                series.size(), calendar.size(), excluded.size());
        return new SeriesBuildResult(List.copyOf(calendar), List.copyOf(series), List.copyOf(excluded), dropped);
    }

    /**
     * Build the series of a single bucket over the given calendar.
     *
     * @throws InsufficientHistoryException when fewer than {@code minNonZeroPeriods} periods have a non-zero sum
     */
    public BucketSeries buildSeries(BucketKey key, List<LedgerTransaction> rows, List<YearMonth> calendar,
                                    int minNonZeroPeriods) {
        Map<YearMonth, List<LedgerTransaction>> byPeriod = new LinkedHashMap<>();
        for (YearMonth period : calendar) {
            byPeriod.put(period, new ArrayList<>());
        }
        String type = null;
        for (LedgerTransaction row : rows) {
            List<LedgerTransaction> bucketRows = byPeriod.get(row.getPeriod());
            if (bucketRows == null) continue; // outside the calendar
            bucketRows.add(row);
            if (type == null) type = row.getType();
        }

        List<PeriodPoint> points = new ArrayList<>(calendar.size());
        long nonZero = 0;
        for (Map.Entry<YearMonth, List<LedgerTransaction>> entry : byPeriod.entrySet()) {
            double sum = 0.0;
            for (LedgerTransaction row : entry.getValue()) {
                sum += row.getAmount();
            }
            if (sum != 0.0) nonZero++;
            points.add(new PeriodPoint(entry.getKey(), sum, entry.getValue().size()));
        }

        if (nonZero < minNonZeroPeriods) {
            throw new InsufficientHistoryException(key, nonZero, minNonZeroPeriods);
        }
        return new BucketSeries(key, type, points, byPeriod);
    }

    static List<YearMonth> calendar(TreeSet<YearMonth> periods, boolean fillGaps) {
        if (periods.isEmpty() || !fillGaps) {
            return new ArrayList<>(periods);
        }
        List<YearMonth> calendar = new ArrayList<>();
        for (YearMonth p = periods.first(); !p.isAfter(periods.last()); p = p.plusMonths(1)) {
            calendar.add(p);
        }
        return calendar;
    }
}
