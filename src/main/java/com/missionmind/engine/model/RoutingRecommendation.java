package com.missionmind.engine.model;

import org.springframework.lang.Nullable;

public record RoutingRecommendation(
        String orgUnitId,
        String rationale,
        @Nullable String matchedKeyword
) {
}
