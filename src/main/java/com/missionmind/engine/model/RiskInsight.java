package com.missionmind.engine.model;

import java.util.List;

public record RiskInsight(
        String taskId,
        RiskTier riskLevel,
        double lateProbability,
        List<String> drivers,
        List<String> recommendedActions
) {
}
