package com.missionmind.api;

/**
 * Partial update. A blank {@code parentId} detaches the unit and makes it a root.
 */
public record OrgUnitUpdateRequest(
        String name,
        String echelon,
        String parentId,
        Boolean active
) {
}
