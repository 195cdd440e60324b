package com.finreview.anomaly.engine;

import com.finreview.anomaly.config.DetectionSettings;
import com.finreview.anomaly.model.BucketSeries;
import com.finreview.anomaly.model.DetectionMethod;
import com.finreview.anomaly.model.DetectorRun;

/**
 * A single outlier-detection method in the ensemble.
 * Each implementation judges every period of one bucket series independently
 * of the other detectors.
 */
public interface Detector {

    /**
     * The method this detector reports in its verdicts.
     */
    DetectionMethod getMethod();

    /**
     * Whether the detector takes part in runs with these settings.
     */
    default boolean isEnabled(DetectionSettings settings) {
        return true;
    }

    /**
     * Evaluate every period of the series.
     *
     * @param series   the bucket series, chronological, zero periods included
     * @param settings thresholds and windows for this run
     * @return verdicts for the periods the detector could judge, plus a
     *         degradation entry for each reason it abstained
     */
    DetectorRun evaluate(BucketSeries series, DetectionSettings settings);
}
