package com.missionmind.api;

import com.missionmind.engine.model.Classification;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

public record TaskCreateRequest(
        @Size(max = 32) String id,
        @NotBlank String title,
        @NotNull String description,
        Classification classification,
        @NotNull LocalDate suspenseDate,
        @NotBlank String originator,
        @NotBlank String orgUnitId,
        String recordSeriesId,
        List<String> tags
) {
}
