package com.finreview.anomaly.model;

import lombok.Value;

import java.util.List;

/** Outcome of detection, reconciliation and attribution for one bucket. */
@Value
public class BucketAnalysis {
    BucketKey key;
    List<AnomalyRecord> anomalies;
    List<DetectorDegradation> degradations;
}
