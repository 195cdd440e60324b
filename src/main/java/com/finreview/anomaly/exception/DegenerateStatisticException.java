package com.finreview.anomaly.exception;

public class DegenerateStatisticException extends AnomalyDetectionException {
    public DegenerateStatisticException(String message) { super(message); }
}
