package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A detector (or a whole bucket) that could not produce verdicts. Non-fatal.")
public class DetectorDegradation {

    @Schema(description = "Bucket name", example = "OPEX - Marketing")
    String bucket;

    @Schema(description = "Entity, when entity partitioning is active", example = "BG01")
    String entity;

    @Schema(description = "Affected detector; null for whole-bucket failures", example = "mad")
    DetectionMethod method;

    @Schema(description = "Kind of degradation", example = "DEGENERATE_STATISTIC")
    DegradationKind kind;

    @Schema(description = "Number of periods the detector abstained on", example = "12")
    int affectedPeriods;

    @Schema(description = "Detail message", example = "MAD of baseline is zero for 12 of 12 periods")
    String message;

    public static DetectorDegradation of(BucketKey key, DetectionMethod method, DegradationKind kind,
                                         int affectedPeriods, String message) {
        return DetectorDegradation.builder()
                .bucket(key.bucket())
                .entity(key.entity())
                .method(method)
                .kind(kind)
                .affectedPeriods(affectedPeriods)
                .message(message)
                .build();
    }
}
