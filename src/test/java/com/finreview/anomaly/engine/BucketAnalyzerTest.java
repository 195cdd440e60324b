package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.config.MetricsConfig;
import com.finreview.anomaly.engine.detectors.IsolationDetector;
import com.finreview.anomaly.engine.detectors.RobustDeviationDetector;
import com.finreview.anomaly.model.AnomalyRecord;
import com.finreview.anomaly.model.BucketAnalysis;
import com.finreview.anomaly.model.BucketKey;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.Confidence;
import com.finreview.anomaly.model.DegradationKind;
import com.finreview.anomaly.model.DetectionMethod;
import com.finreview.anomaly.model.Severity;
import com.finreview.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BucketAnalyzerTest {

    private static final double[] NOISY_WITH_SPIKE = {
            1000, 1020, 980, 1010, 990, 1005, 995, 1015, 985, 1000, 1000, 5000
    };

    @Mock private Detector brokenDetector;

    @Test
    void analyze_noisySpike_singleRecordWithBothStatisticalMethods() {
        BucketSeries series = TestDataFactory.createSeries("OPEX - Marketing", NOISY_WITH_SPIKE);
        DetectionSettings settings = DetectionSettings.defaults().toBuilder().isolationEnabled(false).build();

        BucketAnalysis analysis = TestDataFactory.createAnalyzer().analyze(series, settings);

        assertThat(analysis.getAnomalies()).singleElement().satisfies(record -> {
            assertThat(record.getPeriod()).isEqualTo(TestDataFactory.START.plusMonths(11));
            assertThat(record.getMethods()).containsExactly(DetectionMethod.ZSCORE, DetectionMethod.MAD);
            assertThat(record.getObservedAmount()).isEqualTo(5000.0);
            assertThat(record.getExpectedAmount()).isEqualTo(1000.0);
            assertThat(record.getPctDeviation()).isEqualTo(400.0);
            assertThat(record.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(record.getConfidence()).isEqualTo(Confidence.HIGH);
            assertThat(record.getNormalizedDeviation()).isCloseTo(4000.0 / Math.sqrt(150.0), within(0.01));
            assertThat(record.getContributors()).singleElement()
                    .satisfies(c -> assertThat(c.getShare()).isEqualTo(100.0));
            assertThat(record.getExplanation()).isEqualTo(
                    "400.0% increase vs expected in OPEX - Marketing. Top contributor: VEND-001 (100.0% of deviation)");
        });
    }

    @Test
    void analyze_onlyZScoreFlags_contributorsStayWithinRecordDeviation() {
        // Mean of the history (160) differs from its median (100); MAD abstains on zero MAD
        BucketSeries series = TestDataFactory.createSeries("OPEX - IT",
                100, 100, 100, 100, 100, 100, 100, 100, 400, 400, 600);
        DetectionSettings settings = DetectionSettings.defaults().toBuilder().isolationEnabled(false).build();

        BucketAnalysis analysis = TestDataFactory.createAnalyzer().analyze(series, settings);

        assertThat(analysis.getAnomalies()).singleElement().satisfies(record -> {
            assertThat(record.getMethods()).containsExactly(DetectionMethod.ZSCORE);
            assertThat(record.getExpectedAmount()).isEqualTo(160.0);
            assertThat(record.getDeviation()).isEqualTo(440.0);
            double attributed = record.getContributors().stream().mapToDouble(c -> Math.abs(c.getAmount())).sum();
            assertThat(attributed).isLessThanOrEqualTo(Math.abs(record.getDeviation()));
            assertThat(record.getContributors()).singleElement()
                    .satisfies(c -> assertThat(c.getShare()).isEqualTo(100.0));
        });
    }

    @Test
    void analyze_failingDetector_othersStillReport() {
        when(brokenDetector.getMethod()).thenReturn(DetectionMethod.ZSCORE);
        when(brokenDetector.isEnabled(any())).thenReturn(true);
        when(brokenDetector.evaluate(any(), any())).thenThrow(new IllegalStateException("boom"));

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BucketAnalyzer analyzer = new BucketAnalyzer(
                List.of(brokenDetector, new RobustDeviationDetector(), new IsolationDetector()),
                new EnsembleReconciler(), new AttributionEngine(), new ConfidenceScorer(),
                Tracer.NOOP, new MetricsConfig(registry));

        BucketAnalysis analysis = analyzer.analyze(
                TestDataFactory.createSeries("B", NOISY_WITH_SPIKE), DetectionSettings.defaults());

        assertThat(analysis.getDegradations()).anySatisfy(d -> {
            assertThat(d.getMethod()).isEqualTo(DetectionMethod.ZSCORE);
            assertThat(d.getKind()).isEqualTo(DegradationKind.DETECTOR_ERROR);
            assertThat(d.getMessage()).contains("boom");
        });
        assertThat(analysis.getAnomalies()).singleElement().satisfies(record -> {
            assertThat(record.getMethods()).contains(DetectionMethod.MAD).doesNotContain(DetectionMethod.ZSCORE);
        });
        assertThat(registry.get("detector.degraded").tag("kind", "DETECTOR_ERROR").counter().count()).isEqualTo(1.0);
    }

    @Test
    void analyze_spikeOnFlatHistory_onlyIsolationCanJudgeIt() {
        BucketSeries series = TestDataFactory.createSeries("B", TestDataFactory.flatThen(1000, 11, 5000));

        BucketAnalysis analysis = TestDataFactory.createAnalyzer().analyze(series, DetectionSettings.defaults());

        assertThat(analysis.getAnomalies()).hasSize(1);
        AnomalyRecord record = analysis.getAnomalies().get(0);
        assertThat(record.getMethods()).containsExactly(DetectionMethod.ISOLATION_FOREST);
        assertThat(record.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(record.getConfidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(record.getNormalizedDeviation()).isNull();
        assertThat(record.getHistoricalVolatility()).isEqualTo(0.0);
        assertThat(record.getExpectedLow()).isNull();
        assertThat(analysis.getDegradations()).extracting(d -> d.getMethod())
                .containsExactlyInAnyOrder(DetectionMethod.ZSCORE, DetectionMethod.MAD);
    }

    @Test
    void analyze_flatSeries_noAnomalies() {
        BucketSeries series = TestDataFactory.createSeries("B", TestDataFactory.repeat(1000, 12));

        BucketAnalysis analysis = TestDataFactory.createAnalyzer().analyze(series, DetectionSettings.defaults());

        assertThat(analysis.getAnomalies()).isEmpty();
        assertThat(analysis.getDegradations()).hasSize(3)
                .allSatisfy(d -> assertThat(d.getKind()).isEqualTo(DegradationKind.DEGENERATE_STATISTIC));
    }

    @Test
    void explain_decrease_usesAbsolutePercentage() {
        AnomalyCandidate candidate = AnomalyCandidate.builder()
                .key(BucketKey.of("Revenue - Services"))
                .deviation(-300.0)
                .pctDeviation(-30.0)
                .methods(List.of(DetectionMethod.MAD))
                .build();

        assertThat(BucketAnalyzer.explain(candidate, List.of()))
                .isEqualTo("30.0% decrease vs expected in Revenue - Services");
    }
}
