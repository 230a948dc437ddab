package com.missionmind.api;

import com.missionmind.entity.Comment;

import java.time.OffsetDateTime;

public record CommentResponse(
        Long id,
        String taskId,
        String authorUserId,
        String body,
        Long parentCommentId,
        OffsetDateTime createdAt
) {

    public static CommentResponse from(Comment comment) {
        return new CommentResponse(
                comment.getId(),
                comment.getTask() != null ? comment.getTask().getId() : null,
                comment.getAuthorUserId(),
                comment.getBody(),
                comment.getParentCommentId(),
                comment.getCreatedAt()
        );
    }
}
