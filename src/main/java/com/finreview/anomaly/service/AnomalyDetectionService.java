package com.finreview.anomaly.service;

import com.finreview.anomaly.config.DetectionConfig;
import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.config.MetricsConfig;
import com.finreview.anomaly.engine.BucketAnalyzer;
import com.finreview.anomaly.engine.SeriesBuilder;
import com.finreview.anomaly.exception.AnomalyDetectionException;
import com.finreview.anomaly.exception.InvalidRequestException;
import com.finreview.anomaly.model.AnalysisRequest;
import com.finreview.anomaly.model.AnomalyRecord;
import com.finreview.anomaly.model.AnomalyReport;
import com.finreview.anomaly.model.AnomalySummary;
import com.finreview.anomaly.model.BucketAnalysis;
import com.finreview.anomaly.model.BucketKey;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.DegradationKind;
import com.finreview.anomaly.model.DetectorDegradation;
import com.finreview.anomaly.model.LedgerTransaction;
import com.finreview.anomaly.model.SeriesBuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orchestrates one analysis run.
 *
 * Flow:
 * 1. Filter the input rows by entity and period window
 * 2. Build one series per bucket via the SeriesBuilder (short buckets are excluded)
 * 3. Analyze each bucket independently, on a worker pool when parallel execution is on
 * 4. Stop issuing buckets once the deadline has passed; completed buckets are kept
 * 5. Sort the anomalies (severity desc, bucket, entity, period) and build the report
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final Comparator<AnomalyRecord> REPORT_ORDER = Comparator
            .comparing(AnomalyRecord::getSeverity, Comparator.reverseOrder())
            .thenComparing(AnomalyRecord::getBucket)
            .thenComparing(AnomalyRecord::getEntity, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AnomalyRecord::getPeriod);

    private final SeriesBuilder seriesBuilder;
    private final BucketAnalyzer bucketAnalyzer;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(SeriesBuilder seriesBuilder,
                                   BucketAnalyzer bucketAnalyzer,
                                   DetectionConfig detectionConfig,
                                   MetricsConfig metricsConfig) {
        this.seriesBuilder = seriesBuilder;
        this.bucketAnalyzer = bucketAnalyzer;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Analyze a request with the currently configured detection settings.
     * This is the main entry point called by the REST controller.
     */
    public AnomalyReport analyze(AnalysisRequest request) {
        if (request.getTransactions() == null || request.getTransactions().isEmpty()) {
            throw new InvalidRequestException("transactions", "transactions must not be empty");
        }
        if (request.getFrom() != null && request.getTo() != null && request.getFrom().isAfter(request.getTo())) {
            throw new InvalidRequestException("from", "from must not be after to");
        }

        // Null rows pass through so the SeriesBuilder drops and counts them
        List<LedgerTransaction> rows = request.getTransactions().stream()
                .filter(t -> t == null || request.getEntity() == null || request.getEntity().equals(t.getEntity()))
                .filter(t -> t == null || inWindow(t.getPeriod(), request.getFrom(), request.getTo()))
                .toList();

        Instant deadline = request.getDeadlineMs() != null
                ? Instant.now().plusMillis(request.getDeadlineMs()) : null;
        return analyze(rows, detectionConfig.toSettings(), deadline);
    }

    public AnomalyReport analyze(List<LedgerTransaction> rows, DetectionSettings settings) {
        return analyze(rows, settings, null);
    }

    /**
     * Run the full pipeline over already-materialized rows.
     *
     * @param deadline optional; once passed, no further bucket is started and the
     *                 report is marked incomplete
     */
    public AnomalyReport analyze(List<LedgerTransaction> rows, DetectionSettings settings, Instant deadline) {
        settings.validate();
        long start = System.currentTimeMillis();

        SeriesBuildResult built = seriesBuilder.build(rows, settings);
        built.getExcluded().forEach(e -> metricsConfig.recordBucketExcluded());
        log.info("Analysis started: {} rows, {} buckets eligible, {} excluded, parallel={}",
                rows.size(), built.getSeries().size(), built.getExcluded().size(), settings.isParallel());

        RunCollector collector = new RunCollector();
        if (settings.isParallel() && settings.getMaxWorkers() > 1 && built.getSeries().size() > 1) {
            runParallel(built.getSeries(), settings, deadline, collector);
        } else {
            runSequential(built.getSeries(), settings, deadline, collector);
        }

        List<AnomalyRecord> anomalies = new ArrayList<>(collector.anomalies);
        anomalies.sort(REPORT_ORDER);
        collector.degradations.sort(Comparator.comparing(DetectorDegradation::getBucket)
                .thenComparing(DetectorDegradation::getEntity, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(d -> d.getMethod() == null ? "" : d.getMethod().getWireName()));
        collector.skipped.sort(Comparator.naturalOrder());

        boolean complete = collector.skipped.isEmpty();
        AnomalyReport report = AnomalyReport.builder()
                .runId(UUID.randomUUID().toString())
                .generatedAt(System.currentTimeMillis())
                .anomalies(List.copyOf(anomalies))
                .insufficientHistory(built.getExcluded())
                .degradations(List.copyOf(collector.degradations))
                .skippedBuckets(List.copyOf(collector.skipped))
                .droppedRows(built.getDroppedRows())
                .analyzedBuckets(collector.analyzed)
                .complete(complete)
                .summary(AnomalySummary.of(anomalies))
                .build();

        long duration = System.currentTimeMillis() - start;
        metricsConfig.recordRun(complete, duration, anomalies.size());
        log.info("Analysis {} finished in {}ms: {} anomalies ({} high), {} buckets analyzed, {} skipped, {} degradations",
                report.getRunId(), duration, anomalies.size(), report.getSummary().getHighSeverityCount(),
                collector.analyzed, collector.skipped.size(), collector.degradations.size());
        return report;
    }

    private void runSequential(List<BucketSeries> series, DetectionSettings settings, Instant deadline,
                               RunCollector collector) {
        for (BucketSeries bucket : series) {
            if (deadlinePassed(deadline)) {
                collector.skip(bucket.getKey(), deadline);
                continue;
            }
            try {
                collector.add(bucketAnalyzer.analyze(bucket, settings));
            } catch (RuntimeException e) {
                collector.fail(bucket, e);
            }
        }
    }

    private void runParallel(List<BucketSeries> series, DetectionSettings settings, Instant deadline,
                             RunCollector collector) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.getMaxWorkers(), series.size()));
        CompletionService<BucketAnalysis> completion = new ExecutorCompletionService<>(executor);
        Map<Future<BucketAnalysis>, BucketSeries> inFlight = new HashMap<>();
        Iterator<BucketSeries> pending = series.iterator();

        try {
            while (pending.hasNext() || !inFlight.isEmpty()) {
                // Keep at most maxWorkers buckets queued so the deadline check stays meaningful
                while (pending.hasNext() && inFlight.size() < settings.getMaxWorkers()) {
                    BucketSeries next = pending.next();
                    if (deadlinePassed(deadline)) {
                        collector.skip(next.getKey(), deadline);
                        continue;
                    }
                    inFlight.put(completion.submit(() -> bucketAnalyzer.analyze(next, settings)), next);
                }
                if (inFlight.isEmpty()) {
                    break;
                }

                Future<BucketAnalysis> done = completion.take();
                BucketSeries bucket = inFlight.remove(done);
                try {
                    collector.add(done.get());
                } catch (ExecutionException e) {
                    collector.fail(bucket, e.getCause() != null ? e.getCause() : e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnomalyDetectionException("Analysis interrupted with " + inFlight.size() + " buckets in flight", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static boolean deadlinePassed(Instant deadline) {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    private static boolean inWindow(YearMonth period, YearMonth from, YearMonth to) {
        if (period == null) {
            // left for the SeriesBuilder to drop and count
            return true;
        }
        return (from == null || !period.isBefore(from)) && (to == null || !period.isAfter(to));
    }

    /** Accumulates bucket outcomes; only touched from the submitting thread. */
    private static final class RunCollector {
        private final List<AnomalyRecord> anomalies = new ArrayList<>();
        private final List<DetectorDegradation> degradations = new ArrayList<>();
        private final List<BucketKey> skipped = new ArrayList<>();
        private int analyzed;
        private boolean deadlineLogged;

        void add(BucketAnalysis analysis) {
            anomalies.addAll(analysis.getAnomalies());
            degradations.addAll(analysis.getDegradations());
            analyzed++;
        }

        void fail(BucketSeries bucket, Throwable cause) {
            log.error("Bucket {} failed: {}", bucket.getKey().id(), cause.getMessage(), cause);
            degradations.add(DetectorDegradation.of(bucket.getKey(), null, DegradationKind.BUCKET_FAILURE,
                    bucket.size(), cause.getClass().getSimpleName() + ": " + Objects.toString(cause.getMessage(), "")));
        }

        void skip(BucketKey key, Instant deadline) {
            if (!deadlineLogged) {
                log.warn("Deadline {} reached; remaining buckets are skipped", deadline);
                deadlineLogged = true;
            }
            skipped.add(key);
        }
    }
}
