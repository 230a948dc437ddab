package com.missionmind.service;

import com.missionmind.engine.OrgHierarchyReader;
import com.missionmind.engine.model.OrgUnitView;
import com.missionmind.entity.OrgUnit;
import com.missionmind.repository.OrgUnitRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaOrgHierarchyReader implements OrgHierarchyReader {

    private final OrgUnitRepository orgUnitRepository;

    @Override
    public Optional<String> getParent(String orgUnitId) {
        if (!StringUtils.hasText(orgUnitId)) {
            return Optional.empty();
        }
        return orgUnitRepository.findById(orgUnitId)
                .map(OrgUnit::getParentId)
                .filter(StringUtils::hasText);
    }

    @Override
    public Optional<OrgUnitView> getUnit(String orgUnitId) {
        if (!StringUtils.hasText(orgUnitId)) {
            return Optional.empty();
        }
        return orgUnitRepository.findById(orgUnitId).map(JpaOrgHierarchyReader::toView);
    }

    static OrgUnitView toView(OrgUnit unit) {
        return new OrgUnitView(unit.getId(), unit.getName(), unit.getEchelon(), unit.getParentId());
    }
}
