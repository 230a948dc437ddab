package com.missionmind.engine;

import com.missionmind.engine.model.OrgUnitView;
import com.missionmind.engine.model.RoutingRecommendation;
import com.missionmind.engine.model.TaskSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recommends the owning unit for a task from keyword hits in its tags, title and
 * description. Keywords are tried in table order and the first one whose section unit
 * exists wins. Without a usable hit the task stays with its originating unit.
 */
@Slf4j
public class RoutingRecommender {

    static final String DEFAULT_RATIONALE = "Defaulted to originating org";
    static final String MISSING_METADATA_RATIONALE = "No org metadata available; used provided org unit id";

    private final EngineTables tables;

    public RoutingRecommender(EngineTables tables) {
        Assert.notNull(tables, "tables must not be null");
        this.tables = tables;
    }

    public RoutingRecommendation recommend(TaskSnapshot task, OrgHierarchyReader hierarchyReader) {
        Assert.notNull(task, "task must not be null");
        Assert.notNull(hierarchyReader, "hierarchyReader must not be null");

        for (String keyword : tables.matchingKeywords(searchableText(task))) {
            String section = tables.sectionFor(keyword);
            Optional<OrgUnitView> unit = findUnit(hierarchyReader, section);
            if (unit.isPresent()) {
                OrgUnitView org = unit.get();
                log.debug("Routing task {} to {} on keyword '{}'", task.taskId(), org.id(), keyword);
                return new RoutingRecommendation(org.id(),
                        "Matched keyword '%s' with org %s".formatted(keyword, org.name()), keyword);
            }
            log.debug("Keyword '{}' maps to unknown org {}, trying next keyword", keyword, section);
        }

        return findUnit(hierarchyReader, task.orgUnitId())
                .map(org -> new RoutingRecommendation(org.id(), DEFAULT_RATIONALE, null))
                .orElseGet(() -> new RoutingRecommendation(task.orgUnitId(), MISSING_METADATA_RATIONALE, null));
    }

    private Optional<OrgUnitView> findUnit(OrgHierarchyReader hierarchyReader, String orgUnitId) {
        if (!StringUtils.hasText(orgUnitId)) {
            return Optional.empty();
        }
        try {
            return hierarchyReader.getUnit(orgUnitId);
        } catch (RuntimeException ex) {
            log.warn("Org unit lookup for {} failed, treating it as missing: {}", orgUnitId, ex.getMessage());
            return Optional.empty();
        }
    }

    private static String searchableText(TaskSnapshot task) {
        List<String> parts = new ArrayList<>(task.tags());
        parts.add(task.title());
        parts.add(task.description());
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }
}
