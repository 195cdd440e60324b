package com.finreview.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.List;

/**
 * A reconciled anomaly for one (bucket, period). Immutable once built; this is
 * the value handed to commentary and reporting.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"bucket", "entity", "type", "period", "observed_amount", "expected_amount",
        "expected_low", "expected_high", "deviation", "pct_deviation", "historical_volatility",
        "normalized_deviation", "severity", "confidence", "methods", "contributors", "explanation"})
@Schema(description = "Anomaly detected for one bucket-period, with severity, confidence and attribution")
public class AnomalyRecord {

    @Schema(description = "Bucket name", example = "OPEX - Marketing")
    String bucket;

    @Schema(description = "Entity, when entity partitioning is active", example = "BG01")
    String entity;

    @Schema(description = "Bucket class from the mapping table", example = "opex")
    String type;

    @Schema(description = "Anomalous period", example = "2024-03", type = "string")
    YearMonth period;

    @JsonProperty("observed_amount")
    @Schema(description = "Observed amount for the period", example = "5000.0")
    double observedAmount;

    @JsonProperty("expected_amount")
    @Schema(description = "Expected amount (baseline of the strongest agreeing detector)", example = "1000.0")
    double expectedAmount;

    @JsonProperty("expected_low")
    @Schema(description = "Lower bound of the expected range, if the strongest detector has one", example = "850.0")
    Double expectedLow;

    @JsonProperty("expected_high")
    @Schema(description = "Upper bound of the expected range, if the strongest detector has one", example = "1150.0")
    Double expectedHigh;

    @Schema(description = "Observed minus expected", example = "4000.0")
    double deviation;

    @JsonProperty("pct_deviation")
    @Schema(description = "Deviation as a percentage of the expected amount", example = "400.0")
    double pctDeviation;

    @JsonProperty("historical_volatility")
    @Schema(description = "Coefficient of variation of the bucket's history excluding this period", example = "0.12")
    Double historicalVolatility;

    @JsonProperty("normalized_deviation")
    @Schema(description = "Deviation divided by the historical standard deviation; absent when the history is flat",
            example = "5.3")
    Double normalizedDeviation;

    @Schema(description = "Severity: low, medium or high", example = "high")
    Severity severity;

    @Schema(description = "Confidence: low, medium or high", example = "medium")
    Confidence confidence;

    @Schema(description = "Detectors that flagged this period", example = "[\"zscore\", \"mad\"]")
    List<DetectionMethod> methods;

    @Schema(description = "Top contributors to the deviation, followed by the unattributed remainder")
    List<Contributor> contributors;

    @Schema(description = "One-line explanation",
            example = "400.0% increase vs expected in OPEX - Marketing. Top contributor: ACME Media Ltd (60% of deviation)")
    String explanation;

    public BucketKey key() {
        return new BucketKey(bucket, entity);
    }
}
