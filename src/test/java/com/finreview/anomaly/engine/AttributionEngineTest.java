package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.Contributor;
import com.finreview.anomaly.model.LedgerTransaction;
import com.finreview.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static com.finreview.anomaly.testutil.TestDataFactory.START;
import static com.finreview.anomaly.testutil.TestDataFactory.createRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AttributionEngineTest {

    private static final String BUCKET = "OPEX - Marketing";

    private final AttributionEngine engine = new AttributionEngine();
    private final DetectionSettings settings = DetectionSettings.defaults();
    private final YearMonth spike = START.plusMonths(11);

    @Test
    void attribute_threeCounterparties_sharesMatchTheirPartOfTheDelta() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 11; m++) {
            rows.add(createRow(BUCKET, START.plusMonths(m), 600, "ACME Media"));
            rows.add(createRow(BUCKET, START.plusMonths(m), 300, "Bright Billboards"));
            rows.add(createRow(BUCKET, START.plusMonths(m), 100, "Click Ads"));
        }
        // Delta vs. the 1000 baseline is 4000: 2400 / 1200 / 400
        rows.add(createRow(BUCKET, spike, 3000, "ACME Media"));
        rows.add(createRow(BUCKET, spike, 1500, "Bright Billboards"));
        rows.add(createRow(BUCKET, spike, 500, "Click Ads"));
        BucketSeries series = TestDataFactory.createSeries(BUCKET, rows, 12);

        List<Contributor> contributors = engine.attribute(series, spike, 4000.0, settings);

        assertThat(contributors).extracting(Contributor::getName)
                .containsExactly("ACME Media", "Bright Billboards", "Click Ads");
        assertThat(contributors).extracting(Contributor::getShare).containsExactly(60.0, 30.0, 10.0);
        assertThat(contributors).extracting(Contributor::getAmount).containsExactly(2400.0, 1200.0, 400.0);
        assertThat(contributors.stream().mapToDouble(Contributor::getShare).sum()).isCloseTo(100.0, within(0.01));
    }

    @Test
    void attribute_manyCounterparties_topFivePlusOther() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 12; m++) {
            for (int c = 1; c <= 7; c++) {
                double amount = START.plusMonths(m).equals(spike) ? 200 : 100;
                rows.add(createRow(BUCKET, START.plusMonths(m), amount, "VEND-" + c));
            }
        }
        BucketSeries series = TestDataFactory.createSeries(BUCKET, rows, 12);

        List<Contributor> contributors = engine.attribute(series, spike, 700.0, settings);

        assertThat(contributors).hasSize(6);
        assertThat(contributors.subList(0, 5)).extracting(Contributor::getName)
                .containsExactly("VEND-1", "VEND-2", "VEND-3", "VEND-4", "VEND-5");
        Contributor other = contributors.get(5);
        assertThat(other.getName()).isEqualTo("Other");
        assertThat(other.isUnattributed()).isTrue();
        assertThat(other.getAmount()).isCloseTo(200.0, within(0.01));
        assertThat(contributors.stream().mapToDouble(Contributor::getShare).sum()).isCloseTo(100.0, within(0.05));
    }

    @Test
    void attribute_offsettingCounterparty_sharesNeverExceedHundredPercent() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 11; m++) {
            rows.add(createRow(BUCKET, START.plusMonths(m), 800, "Growing Vendor"));
            rows.add(createRow(BUCKET, START.plusMonths(m), 200, "Shrinking Vendor"));
        }
        rows.add(createRow(BUCKET, spike, 1800, "Growing Vendor"));
        rows.add(createRow(BUCKET, spike, 0.0, "Shrinking Vendor"));
        BucketSeries series = TestDataFactory.createSeries(BUCKET, rows, 12);

        // Delta is 800; Growing Vendor alone moved by +1000
        List<Contributor> contributors = engine.attribute(series, spike, 800.0, settings);

        assertThat(contributors).singleElement().satisfies(c -> {
            assertThat(c.getName()).isEqualTo("Growing Vendor");
            assertThat(c.getAmount()).isCloseTo(800.0, within(0.01));
            assertThat(c.getShare()).isCloseTo(100.0, within(0.01));
        });
    }

    @Test
    void attribute_rowsWithoutCounterparty_groupedAsUnassigned() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 11; m++) {
            rows.add(createRow(BUCKET, START.plusMonths(m), 1000, null));
        }
        rows.add(createRow(BUCKET, spike, 3000, null));
        BucketSeries series = TestDataFactory.createSeries(BUCKET, rows, 12);

        List<Contributor> contributors = engine.attribute(series, spike, 2000.0, settings);

        assertThat(contributors).extracting(Contributor::getName).containsExactly("(unassigned)");
    }

    @Test
    void attribute_decrease_contributorsCarryNegativeAmountsAndPositiveShares() {
        List<LedgerTransaction> rows = new ArrayList<>();
        for (int m = 0; m < 11; m++) {
            rows.add(createRow(BUCKET, START.plusMonths(m), 1000, "Main Customer"));
        }
        rows.add(createRow(BUCKET, spike, 250, "Main Customer"));
        BucketSeries series = TestDataFactory.createSeries(BUCKET, rows, 12);

        List<Contributor> contributors = engine.attribute(series, spike, -750.0, settings);

        assertThat(contributors).singleElement().satisfies(c -> {
            assertThat(c.getAmount()).isEqualTo(-750.0);
            assertThat(c.getShare()).isEqualTo(100.0);
        });
    }

    @Test
    void attribute_zeroDeviation_noContributors() {
        BucketSeries series = TestDataFactory.createSeries(BUCKET, TestDataFactory.repeat(1000, 12));

        assertThat(engine.attribute(series, spike, 0.0, settings)).isEmpty();
    }

    @Test
    void attribute_deviationFromMeanSmallerThanMovementFromMedian_cappedAtDeviation() {
        // Mean of the other periods is 160, their median 100: the vendor moved by 500
        BucketSeries series = TestDataFactory.createSeries(BUCKET, 100, 100, 100, 100, 100, 100, 100, 100, 400, 400, 600);
        YearMonth last = START.plusMonths(10);

        List<Contributor> contributors = engine.attribute(series, last, 440.0, settings);

        assertThat(contributors).singleElement().satisfies(c -> {
            assertThat(c.getName()).isEqualTo("VEND-001");
            assertThat(c.getAmount()).isCloseTo(440.0, within(0.01));
            assertThat(c.getShare()).isCloseTo(100.0, within(0.01));
        });
    }
}
