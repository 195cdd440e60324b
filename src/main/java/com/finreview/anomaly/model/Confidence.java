package com.finreview.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
