package com.missionmind.engine.model;

import java.util.Set;

public record AuthorityView(
        String id,
        String title,
        String orgUnitId,
        String grade,
        Set<String> scope
) {

    public AuthorityView {
        scope = scope == null ? Set.of() : Set.copyOf(scope);
    }
}
