package com.missionmind.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskTier {
    GREEN,
    AMBER,
    RED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
