package com.finreview.anomaly.model;

public enum DegradationKind {
    /** Series shorter than the detector's minimum window. */
    BELOW_MIN_WINDOW,
    /** Zero variance / zero MAD / no feature spread in the baseline. */
    DEGENERATE_STATISTIC,
    /** The isolation model could not be fitted. */
    MODEL_FIT_FAILURE,
    /** Unexpected error inside a statistical detector. */
    DETECTOR_ERROR,
    /** The whole bucket failed; no verdicts were produced for it. */
    BUCKET_FAILURE
}
