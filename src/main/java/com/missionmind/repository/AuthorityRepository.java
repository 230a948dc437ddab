package com.missionmind.repository;

import com.missionmind.entity.Authority;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for managing {@link Authority} entities.
 */
@Repository
public interface AuthorityRepository extends JpaRepository<Authority, String> {

    /**
     * Finds the authorities owned by an org unit in a stable order: oldest first, then by id.
     *
     * @param orgUnitId The owning org unit.
     * @return The matching authorities.
     */
    List<Authority> findByOrgUnitIdOrderByCreatedAtAscIdAsc(String orgUnitId);

    List<Authority> findAllByOrderByOrgUnitIdAscIdAsc();
}
