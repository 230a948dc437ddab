package com.missionmind.engine.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Known task statuses. Status is stored as free text, so lookups return empty for
 * anything this enum does not recognize and callers apply their own default.
 */
public enum TaskStatus {
    DRAFT("draft"),
    OPEN("open"),
    IN_WORK("in_work"),
    OVERDUE("overdue"),
    CLOSED("closed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TaskStatus> fromValue(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TaskStatus candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public boolean matches(String status) {
        return fromValue(status).map(this::equals).orElse(false);
    }
}
