package com.missionmind.engine.model;

import java.util.List;

public record QualityCheckResult(
        String taskId,
        List<QualityIssue> issues,
        boolean passed
) {
}
