package com.missionmind.api;

import com.missionmind.entity.OrgUnit;

public record OrgUnitResponse(
        String id,
        String name,
        String echelon,
        String parentId,
        boolean active
) {

    public static OrgUnitResponse from(OrgUnit unit) {
        return new OrgUnitResponse(unit.getId(), unit.getName(), unit.getEchelon(), unit.getParentId(), unit.isActive());
    }
}
