package com.finreview.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Value
@Builder
@Schema(description = "Counts of anomalies by severity, bucket and type")
public class AnomalySummary {

    @Schema(description = "Total anomalies", example = "7")
    int totalCount;

    @Schema(description = "High-severity anomalies", example = "2")
    int highSeverityCount;

    @Schema(description = "Medium-severity anomalies", example = "3")
    int mediumSeverityCount;

    @Schema(description = "Low-severity anomalies", example = "2")
    int lowSeverityCount;

    @Schema(description = "Anomaly count per bucket")
    Map<String, Integer> byBucket;

    @Schema(description = "Anomaly count per bucket type")
    Map<String, Integer> byType;

    public static AnomalySummary of(List<AnomalyRecord> anomalies) {
        Map<String, Integer> byBucket = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        int high = 0, medium = 0, low = 0;
        for (AnomalyRecord anomaly : anomalies) {
            switch (anomaly.getSeverity()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
            byBucket.merge(anomaly.getBucket(), 1, Integer::sum);
            if (anomaly.getType() != null) {
                byType.merge(anomaly.getType(), 1, Integer::sum);
            }
        }
        return AnomalySummary.builder()
                .totalCount(anomalies.size())
                .highSeverityCount(high)
                .mediumSeverityCount(medium)
                .lowSeverityCount(low)
                .byBucket(Collections.unmodifiableMap(byBucket))
                .byType(Collections.unmodifiableMap(byType))
                .build();
    }
}
