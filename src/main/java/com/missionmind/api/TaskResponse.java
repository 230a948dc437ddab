package com.missionmind.api;

import com.missionmind.engine.model.Classification;
import com.missionmind.entity.Task;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

public record TaskResponse(
        String id,
        String title,
        String description,
        Classification classification,
        LocalDate suspenseDate,
        String originator,
        String orgUnitId,
        String recordSeriesId,
        List<String> tags,
        double priorityScore,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        List<AssignmentResponse> assignments
) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getClassification(),
                task.getSuspenseDate(),
                task.getOriginator(),
                task.getOrgUnitId(),
                task.getRecordSeriesId(),
                List.copyOf(task.getTags()),
                task.getPriorityScore(),
                task.getStatus(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getAssignments().stream().map(AssignmentResponse::from).toList()
        );
    }
}
