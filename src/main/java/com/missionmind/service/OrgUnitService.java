package com.missionmind.service;

import com.missionmind.api.OrgUnitRequest;
import com.missionmind.api.OrgUnitUpdateRequest;
import com.missionmind.engine.AuthorityResolver;
import com.missionmind.engine.OrgHierarchyReader;
import com.missionmind.entity.OrgUnit;
import com.missionmind.repository.OrgUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maintains the org-unit forest. Parent links are validated on write so the
 * hierarchy stays acyclic.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrgUnitService {

    private final OrgUnitRepository orgUnitRepository;
    private final OrgHierarchyReader hierarchyReader;
    private final AuthorityResolver authorityResolver;

    @Transactional
    public OrgUnit create(OrgUnitRequest request) {
        String id = request.id().trim();
        if (orgUnitRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Org unit id '%s' already exists.".formatted(id));
        }
        if (orgUnitRepository.existsByNameIgnoreCase(request.name().trim())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Org unit '%s' already exists.".formatted(request.name().trim()));
        }
        String parentId = StringUtils.hasText(request.parentId()) ? request.parentId().trim() : null;
        if (parentId != null) {
            requireParent(parentId);
        }
        OrgUnit unit = OrgUnit.builder()
                .id(id)
                .name(request.name().trim())
                .echelon(request.echelon())
                .parentId(parentId)
                .build();
        OrgUnit saved = orgUnitRepository.save(unit);
        log.info("Created org unit {} ({}) under {}.", saved.getId(), saved.getName(),
                parentId != null ? parentId : "root");
        return saved;
    }

    @Transactional(readOnly = true)
    public List<OrgUnit> list(@Nullable String parentId, @Nullable String echelon) {
        if (StringUtils.hasText(parentId)) {
            return orgUnitRepository.findByParentIdOrderByIdAsc(parentId).stream()
                    .filter(unit -> !StringUtils.hasText(echelon) || echelon.equalsIgnoreCase(unit.getEchelon()))
                    .toList();
        }
        if (StringUtils.hasText(echelon)) {
            return orgUnitRepository.findByEchelonIgnoreCaseOrderByIdAsc(echelon);
        }
        return orgUnitRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public OrgUnit get(String id) {
        return orgUnitRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Org unit not found."));
    }

    @Transactional
    public OrgUnit update(String id, OrgUnitUpdateRequest request) {
        OrgUnit unit = get(id);
        if (StringUtils.hasText(request.name()) && !request.name().trim().equalsIgnoreCase(unit.getName())) {
            if (orgUnitRepository.existsByNameIgnoreCase(request.name().trim())) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Org unit '%s' already exists.".formatted(request.name().trim()));
            }
            unit.setName(request.name().trim());
        }
        if (request.echelon() != null) {
            unit.setEchelon(request.echelon());
        }
        if (request.parentId() != null) {
            String parentId = StringUtils.hasText(request.parentId()) ? request.parentId().trim() : null;
            if (parentId != null) {
                requireParent(parentId);
                if (wouldCreateCycle(id, parentId)) {
                    throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                            "Moving '%s' under '%s' would create a cycle.".formatted(id, parentId));
                }
            }
            unit.setParentId(parentId);
        }
        if (request.active() != null) {
            if (!request.active() && unit.isActive()) {
                requireNoChildren(unit);
            }
            unit.setActive(request.active());
        }
        return orgUnitRepository.save(unit);
    }

    /**
     * Soft delete: marks the unit inactive. Refused while any unit still names it as parent.
     */
    @Transactional
    public OrgUnit deactivate(String id) {
        OrgUnit unit = get(id);
        requireNoChildren(unit);
        unit.setActive(false);
        OrgUnit saved = orgUnitRepository.save(unit);
        log.info("Deactivated org unit {} ({}).", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * The subtree under {@code rootId} in breadth-first order, root first. Without a root,
     * every unit ordered by id.
     */
    @Transactional(readOnly = true)
    public List<OrgUnit> tree(@Nullable String rootId) {
        if (!StringUtils.hasText(rootId)) {
            return orgUnitRepository.findAllByOrderByIdAsc();
        }
        OrgUnit root = get(rootId.trim());
        List<OrgUnit> subtree = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<OrgUnit> queue = new ArrayDeque<>();
        queue.add(root);
        visited.add(root.getId());
        while (!queue.isEmpty()) {
            OrgUnit current = queue.poll();
            subtree.add(current);
            for (OrgUnit child : orgUnitRepository.findByParentIdOrderByIdAsc(current.getId())) {
                if (visited.add(child.getId())) {
                    queue.add(child);
                } else {
                    log.warn("Org unit {} reached twice while walking the tree under {}", child.getId(), root.getId());
                }
            }
        }
        return subtree;
    }

    /**
     * The unit followed by its ancestors, nearest first.
     */
    @Transactional(readOnly = true)
    public List<OrgUnit> ancestors(String id) {
        get(id);
        return authorityResolver.ancestorChain(id, hierarchyReader).stream()
                .map(orgUnitRepository::findById)
                .flatMap(Optional::stream)
                .toList();
    }

    private void requireParent(String parentId) {
        if (!orgUnitRepository.existsById(parentId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Parent org unit '%s' not found.".formatted(parentId));
        }
    }

    private void requireNoChildren(OrgUnit unit) {
        long children = orgUnitRepository.countByParentId(unit.getId());
        if (children > 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Org unit '%s' has %d child units. Deactivate them first.".formatted(unit.getId(), children));
        }
    }

    private boolean wouldCreateCycle(String id, String newParentId) {
        return id.equals(newParentId) || authorityResolver.ancestorChain(newParentId, hierarchyReader).contains(id);
    }
}
