package com.missionmind.repository;

import com.missionmind.entity.Task;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;

/**
 * Repository interface for managing {@link Task} entities.
 * List filters are expressed as {@link Specification}s so they can be combined freely.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, String>, JpaSpecificationExecutor<Task> {

    static Specification<Task> hasStatus(String status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    static Specification<Task> dueOnOrBefore(LocalDate date) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("suspenseDate"), date);
    }

    static Specification<Task> inOrgUnit(String orgUnitId) {
        return (root, query, cb) -> cb.equal(root.get("orgUnitId"), orgUnitId);
    }
}
