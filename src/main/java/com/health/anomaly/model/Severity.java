package com.health.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    NONE("none"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Severities that get a clinical report attached to their result. */
    public boolean isReportable() {
        return this == MEDIUM || this == HIGH;
    }

    public static Severity fromLabel(String label) {
        for (Severity severity : values()) {
            if (severity.label.equals(label)) return severity;
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
