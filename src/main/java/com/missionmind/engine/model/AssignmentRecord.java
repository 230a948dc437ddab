package com.missionmind.engine.model;

public record AssignmentRecord(
        String taskId,
        AssigneeType assigneeType,
        String assigneeId,
        String role,
        String state,
        String rationale
) {
}
