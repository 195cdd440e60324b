package com.finreview.anomaly.model;

import lombok.Value;

import java.util.List;

/**
 * Everything one detector produced for one bucket: verdicts for the periods it
 * could judge, plus the degradations explaining the periods it abstained on.
 */
@Value
public class DetectorRun {

    DetectionMethod method;
    List<DetectorVerdict> verdicts;
    List<DetectorDegradation> degradations;

    public static DetectorRun of(DetectionMethod method, List<DetectorVerdict> verdicts,
                                 List<DetectorDegradation> degradations) {
        return new DetectorRun(method, List.copyOf(verdicts), List.copyOf(degradations));
    }

    public static DetectorRun abstained(DetectionMethod method, DetectorDegradation degradation) {
        return new DetectorRun(method, List.of(), List.of(degradation));
    }

    public boolean isAbstained() {
        return verdicts.isEmpty();
    }
}
