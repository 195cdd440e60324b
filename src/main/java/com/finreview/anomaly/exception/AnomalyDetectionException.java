package com.finreview.anomaly.exception;

/**
 * Base type for failures raised by the detection pipeline. All subtypes except
 * {@link ConfigurationException} are recovered per bucket or per detector.
 */
public class AnomalyDetectionException extends RuntimeException {
    public AnomalyDetectionException(String message) { super(message); }
    public AnomalyDetectionException(String message, Throwable cause) { super(message, cause); }
}
