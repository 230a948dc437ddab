package com.missionmind.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Issue severity, declared in ascending order.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
