package com.missionmind.engine.model;

public record AuthoritySuggestion(
        String authorityId,
        String title,
        String orgUnitId,
        String grade,
        double confidence,
        String rationale
) {
}
