package com.missionmind.repository;

import com.missionmind.entity.Assignment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Repository interface for managing {@link Assignment} entities.
 */
public interface AssignmentRepository extends JpaRepository<Assignment, Long> {

    List<Assignment> findByTask_IdOrderByIdAsc(String taskId);
}
