package com.missionmind.api;

import com.missionmind.engine.model.AssigneeType;
import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;

public record AssignmentRequest(
        AssigneeType assigneeType,
        @NotBlank String assigneeId,
        @NotBlank String role,
        LocalDate dueOverrideDate,
        String state,
        String rationale
) {
}
