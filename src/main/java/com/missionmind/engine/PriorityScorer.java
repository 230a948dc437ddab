package com.missionmind.engine;

import com.missionmind.engine.model.PriorityBreakdown;
import com.missionmind.engine.model.TaskSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Computes the urgency score stamped on a task: a base offset plus four weighted
 * sub-scores (deadline proximity, originator, keyword hits, status).
 * <p>
 * The urgency sub-score is a step function on days remaining, with the same
 * thresholds the risk tiers are tuned against. Never interpolate between steps.
 */
@Slf4j
public class PriorityScorer {

    static final double BASE = 0.2;
    static final double URGENCY_WEIGHT = 0.35;
    static final double ORIGINATOR_WEIGHT = 0.25;
    static final double KEYWORD_WEIGHT = 0.15;
    static final double STATUS_WEIGHT = 0.05;

    private final EngineTables tables;

    public PriorityScorer(EngineTables tables) {
        Assert.notNull(tables, "tables must not be null");
        this.tables = tables;
    }

    public double score(TaskSnapshot task, LocalDate today) {
        return explain(task, today).score();
    }

    public PriorityBreakdown explain(TaskSnapshot task, LocalDate today) {
        Assert.notNull(task, "task must not be null");
        Assert.notNull(today, "today must not be null");

        double urgency = urgencyScore(task.suspenseDate(), today);
        double originator = tables.originatorWeight(task.originator());
        double keywords = keywordBoost(task.tags(), task.description());
        double status = tables.statusWeight(task.status());

        double total = BASE
                + URGENCY_WEIGHT * urgency
                + ORIGINATOR_WEIGHT * originator
                + KEYWORD_WEIGHT * keywords
                + STATUS_WEIGHT * status;
        double score = Scores.round2(Scores.clamp(total, 0.0, 1.0));
        log.debug("Scored task {}: urgency={}, originator={}, keywords={}, status={} -> {}",
                task.taskId(), urgency, originator, keywords, status, score);
        return new PriorityBreakdown(urgency, originator, keywords, status, score);
    }

    /**
     * A task without a suspense date carries no deadline pressure and gets the lowest step.
     */
    static double urgencyScore(@Nullable LocalDate suspenseDate, LocalDate today) {
        if (suspenseDate == null) {
            return 0.3;
        }
        long days = ChronoUnit.DAYS.between(today, suspenseDate);
        if (days <= 0) {
            return 1.0;
        }
        if (days <= 3) {
            return 0.85;
        }
        if (days <= 7) {
            return 0.7;
        }
        if (days <= 14) {
            return 0.5;
        }
        return 0.3;
    }

    double keywordBoost(List<String> tags, String description) {
        List<String> parts = new ArrayList<>(tags);
        parts.add(description);
        int matches = tables.matchingKeywords(String.join(" ", parts).toLowerCase(Locale.ROOT)).size();
        if (matches == 0) {
            return 0.0;
        }
        return Math.min(0.2 + 0.1 * matches, 0.4);
    }
}
