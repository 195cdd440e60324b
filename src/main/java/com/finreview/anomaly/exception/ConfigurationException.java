package com.finreview.anomaly.exception;

/**
 * Invalid thresholds or window sizes. Fatal: raised before any bucket is processed.
 */
public class ConfigurationException extends AnomalyDetectionException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() { return field; }
}
