package com.finreview.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    ZSCORE("zscore"),
    MAD("mad"),
    ISOLATION_FOREST("isolation_forest");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
