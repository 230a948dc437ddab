package com.missionmind.engine.model;

import java.util.List;

public record TaskSummary(
        String summary,
        RiskTier riskLevel,
        List<String> keyPoints
) {
}
