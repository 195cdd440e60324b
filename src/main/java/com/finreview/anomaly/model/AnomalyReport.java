package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Result of one analysis run. Separates anomalies found, buckets that could not be analyzed, " +
        "and detector-level degradations.")
public class AnomalyReport {

    @Schema(description = "Run identifier", example = "5d0f3c1e-8f7e-4a5b-9d62-1c1f2d3e4a5b")
    String runId;

    @Schema(description = "Generation timestamp in epoch milliseconds", example = "1739886764000")
    long generatedAt;

    @Schema(description = "Anomalies ordered by descending severity, then bucket name")
    List<AnomalyRecord> anomalies;

    @Schema(description = "Buckets excluded for insufficient history")
    List<ExcludedBucket> insufficientHistory;

    @Schema(description = "Detectors that abstained or failed, per bucket")
    List<DetectorDegradation> degradations;

    @Schema(description = "Buckets not analyzed because the deadline passed")
    List<BucketKey> skippedBuckets;

    @Schema(description = "Input rows dropped for missing bucket or period", example = "0")
    int droppedRows;

    @Schema(description = "Number of buckets that went through detection", example = "12")
    int analyzedBuckets;

    @Schema(description = "False when the deadline cut the run short", example = "true")
    boolean complete;

    @Schema(description = "Summary counts")
    AnomalySummary summary;
}
