package com.missionmind.engine.model;

public record QualityIssue(
        String code,
        Severity severity,
        String message
) {
}
