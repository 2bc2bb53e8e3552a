package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a validated anomaly relative to its baseline.
 */
public enum AnomalyType {

    SPIKE("spike"),
    DROP("drop");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
