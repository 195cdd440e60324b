package com.finreview.anomaly.service;

import com.finreview.anomaly.config.DetectionConfig;
import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.config.MetricsConfig;
import com.finreview.anomaly.engine.BucketAnalyzer;
import com.finreview.anomaly.engine.SeriesBuilder;
import com.finreview.anomaly.model.AnomalyReport;
import com.finreview.anomaly.model.BucketAnalysis;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.DegradationKind;
import com.finreview.anomaly.model.LedgerTransaction;
import com.finreview.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceFailureTest {

    @Mock private BucketAnalyzer bucketAnalyzer;

    private AnomalyDetectionService service;
    private List<LedgerTransaction> rows;

    @BeforeEach
    void setUp() {
        service = new AnomalyDetectionService(new SeriesBuilder(), bucketAnalyzer,
                new DetectionConfig(), new MetricsConfig(new SimpleMeterRegistry()));

        rows = new ArrayList<>();
        for (String bucket : List.of("Bad", "Good 1", "Good 2")) {
            rows.addAll(TestDataFactory.createMonthlyRows(bucket, 100, 110, 90, 105, 95, 100));
        }

        when(bucketAnalyzer.analyze(any(), any())).thenAnswer(invocation -> {
            BucketSeries series = invocation.getArgument(0);
            if (series.getKey().bucket().equals("Bad")) {
                throw new IllegalStateException("corrupt bucket");
            }
            return new BucketAnalysis(series.getKey(), List.of(), List.of());
        });
    }

    @Test
    void analyze_parallel_failingBucketRecordedAndOthersComplete() {
        AnomalyReport report = service.analyze(rows, DetectionSettings.defaults().toBuilder().maxWorkers(2).build());

        assertFailureIsolated(report);
    }

    @Test
    void analyze_sequential_failingBucketRecordedAndOthersComplete() {
        AnomalyReport report = service.analyze(rows, TestDataFactory.sequentialSettings());

        assertFailureIsolated(report);
    }

    private void assertFailureIsolated(AnomalyReport report) {
        assertThat(report.getAnalyzedBuckets()).isEqualTo(2);
        assertThat(report.isComplete()).isTrue();
        assertThat(report.getDegradations()).singleElement().satisfies(d -> {
            assertThat(d.getBucket()).isEqualTo("Bad");
            assertThat(d.getKind()).isEqualTo(DegradationKind.BUCKET_FAILURE);
            assertThat(d.getMethod()).isNull();
            assertThat(d.getMessage()).contains("corrupt bucket");
        });
    }
}
