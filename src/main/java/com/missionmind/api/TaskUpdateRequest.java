package com.missionmind.api;

import com.missionmind.engine.model.Classification;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update; null fields are left unchanged.
 */
public record TaskUpdateRequest(
        String title,
        String description,
        Classification classification,
        LocalDate suspenseDate,
        String originator,
        String orgUnitId,
        String recordSeriesId,
        String status,
        List<String> tags
) {
}
