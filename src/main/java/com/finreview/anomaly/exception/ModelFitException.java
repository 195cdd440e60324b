package com.finreview.anomaly.exception;

public class ModelFitException extends AnomalyDetectionException {
    public ModelFitException(String message) { super(message); }
    public ModelFitException(String message, Throwable cause) { super(message, cause); }
}
