package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.model.Confidence;
import org.springframework.stereotype.Component;

/**
 * Maps detector agreement and normalized deviation to a confidence label.
 *
 *   3 detectors agree → HIGH
 *   2 detectors agree → HIGH if normalized deviation >= 3, else MEDIUM
 *   1 detector        → MEDIUM if normalized deviation >= 4, else LOW
 *
 * Pure lookup; never lower for more agreeing detectors at the same deviation.
 */
@Component
public class ConfidenceScorer {

    public Confidence score(int agreeingDetectors, double normalizedDeviation, DetectionSettings settings) {
        if (agreeingDetectors >= 3) {
            return Confidence.HIGH;
        }
        if (agreeingDetectors == 2) {
            return normalizedDeviation >= settings.getConfidenceTwoDetectorHighNormalized()
                    ? Confidence.HIGH : Confidence.MEDIUM;
        }
        if (agreeingDetectors == 1) {
            return normalizedDeviation >= settings.getConfidenceOneDetectorMediumNormalized()
                    ? Confidence.MEDIUM : Confidence.LOW;
        }
        return Confidence.LOW;
    }
}
