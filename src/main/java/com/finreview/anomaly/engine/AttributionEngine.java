package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.Contributor;
import com.finreview.anomaly.model.LedgerTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Drill-down of an anomalous period into the counterparties that caused it.
 *
 * The delta being explained is the deviation reported on the anomaly record
 * (observed minus expected). Each counterparty's contribution is its amount in
 * the period minus the median of its own amounts over the rest of the history,
 * where periods without rows count as zero. Only contributions pushing in the
 * direction of the delta are attributed, capped so their total never exceeds the
 * delta; the remainder goes to a synthetic "Other" entry.
 *
 * Works on raw ledger rows only, never on detector output.
 */
@Component
public class AttributionEngine {

    private static final Logger log = LoggerFactory.getLogger(AttributionEngine.class);

    private static final double NEGLIGIBLE_SHARE = 0.005;

    /**
     * @param delta deviation of the period from its expected amount; shares are
     *              relative to it and the attributed amounts never exceed it
     */
    public List<Contributor> attribute(BucketSeries series, YearMonth period, double delta,
                                       DetectionSettings settings) {
        int index = series.indexOf(period);
        if (index < 0 || series.size() < 2) {
            return List.of();
        }
        if (delta == 0.0 || !Double.isFinite(delta)) {
            return List.of();
        }

        Map<String, double[]> amountsByCounterparty = amountsByCounterparty(series, settings);

        List<Contributor> raw = new ArrayList<>();
        for (Map.Entry<String, double[]> entry : amountsByCounterparty.entrySet()) {
            double[] amounts = entry.getValue();
            double baseline = SeriesStatistics.median(SeriesStatistics.excluding(amounts, index));
            double contribution = amounts[index] - baseline;
            if (Math.signum(contribution) == Math.signum(delta)) {
                raw.add(Contributor.builder().name(entry.getKey()).amount(contribution).build());
            }
        }

        double attributedTotal = raw.stream().mapToDouble(Contributor::getAmount).sum();
        double scale = Math.abs(attributedTotal) > Math.abs(delta) ? delta / attributedTotal : 1.0;

        List<Contributor> ranked = raw.stream()
                .map(c -> share(c.getName(), c.getAmount() * scale, delta, false))
                .sorted(Comparator.comparingDouble((Contributor c) -> Math.abs(c.getAmount())).reversed()
                        .thenComparing(Contributor::getName))
                .limit(settings.getMaxContributors())
                .toList();

        List<Contributor> result = new ArrayList<>(ranked);
        double remainder = delta - ranked.stream().mapToDouble(Contributor::getAmount).sum();
        if (Math.abs(remainder / delta) * 100.0 >= NEGLIGIBLE_SHARE) {
            result.add(share(settings.getOtherLabel(), remainder, delta, true));
        }

        log.debug("Attributed {} {}: delta={}, contributors={}", series.getKey().id(), period,
                SeriesStatistics.round(delta, 2), result.size());
        return result;
    }

    /** Per-counterparty amount for every period of the series, zero where it had no rows. */
    private Map<String, double[]> amountsByCounterparty(BucketSeries series, DetectionSettings settings) {
        Map<String, double[]> byCounterparty = new TreeMap<>();
        for (int i = 0; i < series.size(); i++) {
            for (LedgerTransaction row : series.transactionsIn(series.point(i).period())) {
                String name = row.getCounterparty() == null || row.getCounterparty().isBlank()
                        ? settings.getUnassignedLabel() : row.getCounterparty();
                byCounterparty.computeIfAbsent(name, n -> new double[series.size()])[i] += row.getAmount();
            }
        }
        return byCounterparty;
    }

    private static Contributor share(String name, double amount, double delta, boolean unattributed) {
        return Contributor.builder()
                .name(name)
                .amount(SeriesStatistics.round(amount, 2))
                .share(SeriesStatistics.round(amount / delta * 100.0, 2))
                .unattributed(unattributed)
                .build();
    }
}
