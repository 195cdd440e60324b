package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.Map;

@Value
@Builder
@Schema(description = "Verdict of one detector for one bucket-period")
public class DetectorVerdict {

    @Schema(description = "Detector that produced the verdict", example = "zscore")
    DetectionMethod method;

    @Schema(description = "Period under test", example = "2024-03", type = "string")
    YearMonth period;

    @Schema(description = "Observed amount of the period", example = "5000.0")
    double observed;

    @Schema(description = "Whether the detector flags the period", example = "true")
    boolean flagged;

    @Schema(description = "Deviation score in the detector's native units (z, robust z or isolation score)", example = "4.2")
    double score;

    @Schema(description = "Baseline value the period is compared with", example = "1000.0")
    double expected;

    @Schema(description = "Lower bound of the accepted band, when the detector has one", example = "700.0")
    Double expectedLow;

    @Schema(description = "Upper bound of the accepted band, when the detector has one", example = "1300.0")
    Double expectedHigh;

    @Schema(description = "Raw statistics used (mean/stdDev, median/mad, anomalyScore/cutoff)")
    Map<String, Double> statistics;

    @Schema(description = "Human-readable explanation of the verdict")
    String reason;

    public double deviation() {
        return observed - expected;
    }
}
