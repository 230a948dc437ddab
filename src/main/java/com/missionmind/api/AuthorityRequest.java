package com.missionmind.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Set;

public record AuthorityRequest(
        @NotBlank @Size(max = 64) String id,
        @NotBlank String title,
        @NotBlank String orgUnitId,
        String grade,
        Set<String> scope
) {
}
