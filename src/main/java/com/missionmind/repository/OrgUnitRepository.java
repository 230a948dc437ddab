package com.missionmind.repository;

import com.missionmind.entity.OrgUnit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for managing {@link OrgUnit} entities.
 */
@Repository
public interface OrgUnitRepository extends JpaRepository<OrgUnit, String> {

    boolean existsByNameIgnoreCase(String name);

    List<OrgUnit> findByParentIdOrderByIdAsc(String parentId);

    long countByParentId(String parentId);

    List<OrgUnit> findByEchelonIgnoreCaseOrderByIdAsc(String echelon);

    List<OrgUnit> findAllByOrderByIdAsc();
}
