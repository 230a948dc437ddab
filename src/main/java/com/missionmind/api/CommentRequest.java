package com.missionmind.api;

import jakarta.validation.constraints.NotBlank;

public record CommentRequest(
        @NotBlank String authorUserId,
        @NotBlank String body,
        Long parentCommentId
) {
}
