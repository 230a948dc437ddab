package com.missionmind.engine;

import com.missionmind.engine.model.AuthoritySuggestion;
import com.missionmind.engine.model.AuthorityView;
import com.missionmind.engine.model.TaskSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks approving authorities for a task by walking from the task's unit up through its
 * ancestors. Closer tiers come first and carry more confidence; within a tier the lookup's
 * listing order is kept.
 * <p>
 * The hierarchy is expected to be a forest, but parent pointers are not constrained by
 * storage, so the walk stops on a revisited unit and at {@code maxDepth} tiers.
 */
@Slf4j
public class AuthorityResolver {

    public static final int DEFAULT_LIMIT = 3;
    public static final int DEFAULT_MAX_DEPTH = 16;

    static final double TOP_CONFIDENCE = 0.9;
    static final double CONFIDENCE_STEP = 0.1;
    static final double MIN_CONFIDENCE = 0.4;

    static final String FALLBACK_ID = "DEFAULT";
    static final String FALLBACK_TITLE = "Org Chief";
    static final String FALLBACK_GRADE = "GS-15";
    static final String FALLBACK_RATIONALE = "No authority records available; defaulting to org chief.";

    private final int defaultLimit;
    private final int maxDepth;

    public AuthorityResolver() {
        this(DEFAULT_LIMIT, DEFAULT_MAX_DEPTH);
    }

    public AuthorityResolver(int defaultLimit, int maxDepth) {
        Assert.isTrue(defaultLimit > 0, "defaultLimit must be positive");
        Assert.isTrue(maxDepth > 0, "maxDepth must be positive");
        this.defaultLimit = defaultLimit;
        this.maxDepth = maxDepth;
    }

    public List<AuthoritySuggestion> suggest(TaskSnapshot task,
                                             OrgHierarchyReader hierarchyReader,
                                             AuthorityLookup authorityLookup) {
        return suggest(task, hierarchyReader, authorityLookup, defaultLimit);
    }

    public List<AuthoritySuggestion> suggest(TaskSnapshot task,
                                             OrgHierarchyReader hierarchyReader,
                                             AuthorityLookup authorityLookup,
                                             int limit) {
        Assert.notNull(task, "task must not be null");
        Assert.notNull(hierarchyReader, "hierarchyReader must not be null");
        Assert.notNull(authorityLookup, "authorityLookup must not be null");
        Assert.isTrue(limit > 0, "limit must be positive");

        List<String> chain = ancestorChain(task.orgUnitId(), hierarchyReader);
        List<AuthoritySuggestion> suggestions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int tier = 0; tier < chain.size(); tier++) {
            Optional<List<AuthorityView>> authorities = listAuthorities(authorityLookup, chain.get(tier));
            if (authorities.isEmpty()) {
                break;
            }
            double confidence = confidenceForTier(tier);
            for (AuthorityView authority : authorities.get()) {
                if (authority == null || !seen.add(authority.id())) {
                    continue;
                }
                suggestions.add(new AuthoritySuggestion(
                        authority.id(),
                        authority.title(),
                        authority.orgUnitId(),
                        authority.grade(),
                        confidence,
                        "Authority aligned with org %s (tier %d)".formatted(authority.orgUnitId(), tier + 1)));
                if (suggestions.size() >= limit) {
                    return List.copyOf(suggestions);
                }
            }
        }

        if (suggestions.isEmpty()) {
            log.debug("No authorities along {} for task {}, using fallback", chain, task.taskId());
            return List.of(new AuthoritySuggestion(FALLBACK_ID, FALLBACK_TITLE, task.orgUnitId(), FALLBACK_GRADE,
                    MIN_CONFIDENCE, FALLBACK_RATIONALE));
        }
        return List.copyOf(suggestions);
    }

    /**
     * Unit ids from {@code orgUnitId} up to its root, nearest first. Stops early on a cycle,
     * at the depth bound, or when a parent lookup fails.
     */
    public List<String> ancestorChain(String orgUnitId, OrgHierarchyReader hierarchyReader) {
        Assert.notNull(hierarchyReader, "hierarchyReader must not be null");
        Set<String> chain = new LinkedHashSet<>();
        String current = orgUnitId;
        while (StringUtils.hasText(current)) {
            if (chain.size() >= maxDepth) {
                log.warn("Org hierarchy walk from {} hit the depth bound of {}", orgUnitId, maxDepth);
                break;
            }
            if (!chain.add(current)) {
                log.warn("Org hierarchy cycle detected at {} (walked {})", current, chain);
                break;
            }
            current = parentOf(hierarchyReader, current).orElse(null);
        }
        return List.copyOf(chain);
    }

    static double confidenceForTier(int tier) {
        return Scores.round2(Math.max(TOP_CONFIDENCE - CONFIDENCE_STEP * tier, MIN_CONFIDENCE));
    }

    private Optional<String> parentOf(OrgHierarchyReader hierarchyReader, String orgUnitId) {
        try {
            return hierarchyReader.getParent(orgUnitId);
        } catch (RuntimeException ex) {
            log.warn("Parent lookup for {} failed, ending the ancestor walk: {}", orgUnitId, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<List<AuthorityView>> listAuthorities(AuthorityLookup authorityLookup, String orgUnitId) {
        try {
            List<AuthorityView> authorities = authorityLookup.listByOrgUnit(orgUnitId);
            return Optional.of(authorities == null ? List.of() : authorities);
        } catch (RuntimeException ex) {
            log.warn("Authority lookup for {} failed, ending the search: {}", orgUnitId, ex.getMessage());
            return Optional.empty();
        }
    }
}
