package com.missionmind.api;

import com.missionmind.engine.model.AssigneeType;
import com.missionmind.entity.Assignment;

import java.time.LocalDate;
import java.time.OffsetDateTime;

public record AssignmentResponse(
        Long id,
        String taskId,
        AssigneeType assigneeType,
        String assigneeId,
        String role,
        LocalDate dueOverrideDate,
        String state,
        String rationale,
        OffsetDateTime createdAt
) {

    public static AssignmentResponse from(Assignment assignment) {
        return new AssignmentResponse(
                assignment.getId(),
                assignment.getTask() != null ? assignment.getTask().getId() : null,
                assignment.getAssigneeType(),
                assignment.getAssigneeId(),
                assignment.getRole(),
                assignment.getDueOverrideDate(),
                assignment.getState(),
                assignment.getRationale(),
                assignment.getCreatedAt()
        );
    }
}
