package com.missionmind.engine.model;

/**
 * Normalized sub-scores behind a priority score. Each sub-score is in [0,1] before
 * weighting; {@code score} is the final clamped and rounded value.
 */
public record PriorityBreakdown(
        double urgency,
        double originator,
        double keywordBoost,
        double status,
        double score
) {
}
