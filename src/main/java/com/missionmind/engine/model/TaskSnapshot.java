package com.missionmind.engine.model;

import lombok.Builder;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a task as the engine sees it. Null text fields become empty strings
 * and a null tag list becomes an empty list so the scoring rules never see nulls.
 */
@Builder(toBuilder = true)
public record TaskSnapshot(
        String taskId,
        String title,
        String description,
        List<String> tags,
        Classification classification,
        LocalDate suspenseDate,
        String originator,
        String orgUnitId,
        String status,
        String recordSeriesId,
        double priorityScore
) {

    public TaskSnapshot {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
        classification = classification == null ? Classification.UNCLASSIFIED : classification;
        originator = originator == null ? "" : originator;
        status = status == null ? "" : status;
    }

    public TaskSnapshot withPriorityScore(double score) {
        return toBuilder().priorityScore(score).build();
    }
}
