package com.missionmind.service;

import com.missionmind.engine.AuthorityLookup;
import com.missionmind.engine.model.AuthorityView;
import com.missionmind.entity.Authority;
import com.missionmind.repository.AuthorityRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaAuthorityLookup implements AuthorityLookup {

    private final AuthorityRepository authorityRepository;

    @Override
    public List<AuthorityView> listByOrgUnit(String orgUnitId) {
        if (!StringUtils.hasText(orgUnitId)) {
            return List.of();
        }
        return authorityRepository.findByOrgUnitIdOrderByCreatedAtAscIdAsc(orgUnitId).stream()
                .map(JpaAuthorityLookup::toView)
                .toList();
    }

    static AuthorityView toView(Authority authority) {
        return new AuthorityView(authority.getId(), authority.getTitle(), authority.getOrgUnitId(),
                authority.getGrade(), authority.getScope());
    }
}
