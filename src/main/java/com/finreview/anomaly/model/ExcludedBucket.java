package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Bucket excluded from detection because its history is too short")
public class ExcludedBucket {

    @Schema(description = "Bucket name", example = "OPEX - Travel")
    String bucket;

    @Schema(description = "Entity, when entity partitioning is active", example = "BG01")
    String entity;

    @Schema(description = "Number of periods with non-zero activity", example = "2")
    long nonZeroPeriods;

    @Schema(description = "Minimum number of non-zero periods required", example = "3")
    int requiredPeriods;

    @Schema(description = "Reason shown to the user", example = "insufficient history")
    String reason;
}
