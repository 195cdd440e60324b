package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.model.BucketKey;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.ExcludedBucket;
import com.finreview.anomaly.model.LedgerTransaction;
import com.finreview.anomaly.model.PeriodPoint;
import com.finreview.anomaly.model.SeriesBuildResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.finreview.anomaly.testutil.TestDataFactory.START;
import static com.finreview.anomaly.testutil.TestDataFactory.createRow;
import static org.assertj.core.api.Assertions.assertThat;

class SeriesBuilderTest {

    private final SeriesBuilder builder = new SeriesBuilder();
    private final DetectionSettings settings = DetectionSettings.defaults();

    @Test
    void build_missingMonths_filledWithExplicitZeros() {
        List<LedgerTransaction> rows = new ArrayList<>();
        rows.add(createRow("A", START, 100, "X"));
        rows.add(createRow("A", START.plusMonths(1), 120, "X"));
        rows.add(createRow("A", START.plusMonths(3), 90, "X"));
        rows.add(createRow("B", START.plusMonths(5), 40, "Y"));
        rows.add(createRow("B", START, 10, "Y"));
        rows.add(createRow("B", START.plusMonths(2), 20, "Y"));

        SeriesBuildResult result = builder.build(rows, settings);

        assertThat(result.getCalendar()).hasSize(6).first().isEqualTo(START);
        BucketSeries a = result.getSeries().get(0);
        assertThat(a.getKey()).isEqualTo(BucketKey.of("A"));
        assertThat(a.getPoints()).extracting(PeriodPoint::amount)
                .containsExactly(100.0, 120.0, 0.0, 90.0, 0.0, 0.0);
        assertThat(a.point(2).transactionCount()).isZero();
        assertThat(a.transactionsIn(START.plusMonths(2))).isEmpty();
    }

    @Test
    void build_gapFillingOff_usesDistinctPeriodsOnly() {
        List<LedgerTransaction> rows = List.of(
                createRow("A", START, 100, "X"),
                createRow("A", START.plusMonths(4), 110, "X"),
                createRow("A", START.plusMonths(9), 90, "X"));

        SeriesBuildResult result = builder.build(rows, settings.toBuilder().fillCalendarGaps(false).build());

        assertThat(result.getCalendar()).containsExactly(START, START.plusMonths(4), START.plusMonths(9));
        assertThat(result.getSeries().get(0).size()).isEqualTo(3);
    }

    @Test
    void build_rowsInSamePeriod_summedAndCounted() {
        List<LedgerTransaction> rows = List.of(
                createRow("A", START, 100, "X"),
                createRow("A", START, -30, "Y"),
                createRow("A", START.plusMonths(1), 50, "X"),
                createRow("A", START.plusMonths(2), 60, "X"));

        BucketSeries series = builder.build(rows, settings).getSeries().get(0);

        assertThat(series.point(0)).isEqualTo(new PeriodPoint(START, 70.0, 2));
        assertThat(series.transactionsIn(START)).hasSize(2);
    }

    @Test
    void build_bucketWithTooFewActivePeriods_excludedNotFailed() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 12; m++) {
            rows.add(createRow("Steady", START.plusMonths(m), 1000, "X"));
        }
        rows.add(createRow("Rare", START.plusMonths(2), 500, "Z"));
        rows.add(createRow("Rare", START.plusMonths(8), 700, "Z"));
        // Offsetting rows net to zero: not an active period
        rows.add(createRow("Rare", START.plusMonths(9), 300, "Z"));
        rows.add(createRow("Rare", START.plusMonths(9), -300, "Z"));

        SeriesBuildResult result = builder.build(rows, settings);

        assertThat(result.getSeries()).extracting(s -> s.getKey().bucket()).containsExactly("Steady");
        assertThat(result.getExcluded()).singleElement().satisfies(e -> {
            assertThat(e.getBucket()).isEqualTo("Rare");
            assertThat(e.getNonZeroPeriods()).isEqualTo(2);
            assertThat(e.getRequiredPeriods()).isEqualTo(3);
            assertThat(e.getReason()).isEqualTo("insufficient history");
        });
    }

    @Test
    void build_rowsWithoutBucketOrPeriod_droppedAndCounted() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 4; m++) {
            rows.add(createRow("A", START.plusMonths(m), 100 + m, "X"));
        }
        rows.add(createRow(null, START, 5, "X"));
        rows.add(createRow("A", null, 5, "X"));

        SeriesBuildResult result = builder.build(rows, settings);

        assertThat(result.getDroppedRows()).isEqualTo(2);
        assertThat(result.getSeries()).hasSize(1);
        assertThat(result.getSeries().get(0).size()).isEqualTo(4);
    }

    @Test
    void build_entityPartitioning_separatesSeriesPerEntity() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 4; m++) {
            LedgerTransaction bg = createRow("A", START.plusMonths(m), 100, "X");
            LedgerTransaction ro = createRow("A", START.plusMonths(m), 200, "X");
            ro.setEntity("RO01");
            rows.add(ro);
            rows.add(bg);
        }

        List<BucketSeries> partitioned = builder.build(rows, settings.toBuilder().entityPartitioning(true).build())
                .getSeries();
        List<BucketSeries> merged = builder.build(rows, settings).getSeries();

        assertThat(partitioned).extracting(s -> s.getKey().id()).containsExactly("A@BG01", "A@RO01");
        assertThat(merged).singleElement().satisfies(s -> assertThat(s.point(0).amount()).isEqualTo(300.0));
    }

    @Test
    void build_excludedBucketsNeverReachDetection() {
        List<LedgerTransaction> rows = List.of(createRow("Lonely", START, 10, "X"));

        SeriesBuildResult result = builder.build(rows, settings);

        assertThat(result.getSeries()).isEmpty();
        assertThat(result.getExcluded()).extracting(ExcludedBucket::getBucket).containsExactly("Lonely");
    }
}
