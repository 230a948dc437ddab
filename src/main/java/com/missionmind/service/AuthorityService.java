package com.missionmind.service;

import com.missionmind.api.AuthorityRequest;
import com.missionmind.entity.Authority;
import com.missionmind.repository.AuthorityRepository;
import com.missionmind.repository.OrgUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuthorityService {

    private final AuthorityRepository authorityRepository;
    private final OrgUnitRepository orgUnitRepository;

    @Transactional
    public Authority create(AuthorityRequest request) {
        String id = request.id().trim();
        if (authorityRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Authority '%s' already exists.".formatted(id));
        }
        String orgUnitId = request.orgUnitId().trim();
        if (!orgUnitRepository.existsById(orgUnitId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Org unit '%s' not found.".formatted(orgUnitId));
        }
        Authority authority = Authority.builder()
                .id(id)
                .title(request.title())
                .orgUnitId(orgUnitId)
                .grade(request.grade())
                .scope(normalizeScope(request.scope()))
                .build();
        Authority saved = authorityRepository.save(authority);
        log.info("Registered authority {} ({}) for org unit {}.", saved.getId(), saved.getTitle(), orgUnitId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Authority> list(@Nullable String orgUnitId) {
        if (StringUtils.hasText(orgUnitId)) {
            return authorityRepository.findByOrgUnitIdOrderByCreatedAtAscIdAsc(orgUnitId);
        }
        return authorityRepository.findAllByOrderByOrgUnitIdAscIdAsc();
    }

    @Transactional(readOnly = true)
    public Authority get(String id) {
        return authorityRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Authority not found."));
    }

    private static Set<String> normalizeScope(@Nullable Set<String> scope) {
        Set<String> normalized = new LinkedHashSet<>();
        if (scope == null) {
            return normalized;
        }
        for (String keyword : scope) {
            if (StringUtils.hasText(keyword)) {
                normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }
}
