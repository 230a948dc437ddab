package com.missionmind.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OrgUnitRequest(
        @NotBlank @Size(max = 64) String id,
        @NotBlank String name,
        String echelon,
        String parentId
) {
}
