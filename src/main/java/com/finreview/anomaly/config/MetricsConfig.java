package com.finreview.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastRunAnomalyCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunAnomalyCount = registry.gauge("analysis.last_run.anomalies", new AtomicInteger(0));
    }

    public void recordRun(boolean complete, long durationMs, int anomalyCount) {
        Counter.builder("analysis.runs")
                .tag("outcome", complete ? "complete" : "partial")
                .register(registry)
                .increment();

        Timer.builder("analysis.duration")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);

        lastRunAnomalyCount.set(anomalyCount);
    }

    public void recordAnomaly(String severity) {
        Counter.builder("analysis.anomalies")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordBucketExcluded() {
        Counter.builder("analysis.buckets.excluded")
                .register(registry)
                .increment();
    }

    public void recordDetectorFlagged(String method, int flaggedPeriods) {
        Counter.builder("detector.flagged")
                .tag("method", method)
                .register(registry)
                .increment(flaggedPeriods);
    }

    public void recordDetectorDegraded(String method, String kind) {
        Counter.builder("detector.degraded")
                .tag("method", method)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
