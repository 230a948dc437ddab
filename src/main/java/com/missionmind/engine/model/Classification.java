package com.missionmind.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Classification {
    UNCLASSIFIED("U"),
    CONFIDENTIAL("C"),
    SECRET("S"),
    TOP_SECRET("TS");

    private final String code;

    Classification(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Accepts the marking code ("U", "TS"), the enum name or the hyphenated value.
     * Unrecognized markings fall back to {@link #UNCLASSIFIED}.
     */
    @JsonCreator
    public static Classification fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNCLASSIFIED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Classification classification : values()) {
            if (classification.name().equals(normalized) || classification.code.equals(normalized)) {
                return classification;
            }
        }
        return UNCLASSIFIED;
    }
}
