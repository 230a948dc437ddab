package com.missionmind.engine;

import com.missionmind.engine.model.AuthorityView;

import java.util.List;

/**
 * Read-only access to authority records.
 */
public interface AuthorityLookup {

    /**
     * Lists the authorities owned by a unit. The order must be stable between calls since
     * it is the tie-break when ranking suggestions within one tier.
     */
    List<AuthorityView> listByOrgUnit(String orgUnitId);
}
