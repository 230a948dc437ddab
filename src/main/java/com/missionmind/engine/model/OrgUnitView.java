package com.missionmind.engine.model;

public record OrgUnitView(
        String id,
        String name,
        String echelon,
        String parentId
) {

    public boolean isRoot() {
        return parentId == null || parentId.isBlank();
    }
}
