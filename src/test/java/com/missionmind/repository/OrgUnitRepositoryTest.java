package com.missionmind.repository;

import com.missionmind.entity.OrgUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrgUnitRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private OrgUnitRepository orgUnitRepository;

    @Test
    void testSaveAndQueryHierarchy() {
        orgUnitRepository.save(OrgUnit.builder().id("HQ").name("Headquarters").echelon("corps").build());
        orgUnitRepository.save(OrgUnit.builder().id("OPS_G3").name("Operations G3").echelon("staff").parentId("HQ").build());
        orgUnitRepository.save(OrgUnit.builder().id("INTEL_G2").name("Intelligence G2").echelon("staff").parentId("HQ").build());

        assertTrue(orgUnitRepository.existsByNameIgnoreCase("operations g3"));
        assertEquals(List.of("INTEL_G2", "OPS_G3"),
                orgUnitRepository.findByParentIdOrderByIdAsc("HQ").stream().map(OrgUnit::getId).toList());
        assertEquals(2, orgUnitRepository.findByEchelonIgnoreCaseOrderByIdAsc("STAFF").size());
        assertEquals(2, orgUnitRepository.countByParentId("HQ"));
        assertEquals(0, orgUnitRepository.countByParentId("OPS_G3"));
        assertTrue(orgUnitRepository.findById("HQ").orElseThrow().isActive());
    }
}
