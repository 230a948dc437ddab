package com.missionmind.repository;

import com.missionmind.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Repository interface for managing {@link Comment} entities.
 */
public interface CommentRepository extends JpaRepository<Comment, Long> {

    /**
     * Lists the comments on a task, oldest first.
     *
     * @param taskId The task identifier.
     * @return The comments in creation order.
     */
    List<Comment> findByTask_IdOrderByCreatedAtAscIdAsc(String taskId);
}
