package com.health.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Trend {
    IMPROVING("improving"),
    DECLINING("declining"),
    STABLE("stable"),
    UNKNOWN("unknown");

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Trend fromLabel(String label) {
        for (Trend trend : values()) {
            if (trend.label.equals(label)) return trend;
        }
        throw new IllegalArgumentException("Unknown trend: " + label);
    }
}
