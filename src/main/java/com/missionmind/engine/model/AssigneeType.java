package com.missionmind.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssigneeType {
    ORGANIZATION("org"),
    USER("user");

    private final String value;

    AssigneeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
