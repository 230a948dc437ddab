package com.missionmind.engine;

import com.missionmind.engine.model.OrgUnitView;

import java.util.Optional;

/**
 * Read-only access to the organizational-unit forest.
 */
public interface OrgHierarchyReader {

    /**
     * @param orgUnitId unit identifier
     * @return the parent identifier, or empty when the unit is a root or unknown
     */
    Optional<String> getParent(String orgUnitId);

    Optional<OrgUnitView> getUnit(String orgUnitId);
}
