package com.missionmind.api;

import com.missionmind.entity.Authority;

import java.util.List;

public record AuthorityResponse(
        String id,
        String title,
        String orgUnitId,
        String grade,
        List<String> scope
) {

    public static AuthorityResponse from(Authority authority) {
        return new AuthorityResponse(authority.getId(), authority.getTitle(), authority.getOrgUnitId(),
                authority.getGrade(), List.copyOf(authority.getScope()));
    }
}
