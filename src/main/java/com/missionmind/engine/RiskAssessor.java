package com.missionmind.engine;

import com.missionmind.engine.model.RiskInsight;
import com.missionmind.engine.model.RiskTier;
import com.missionmind.engine.model.TaskSnapshot;
import com.missionmind.engine.model.TaskStatus;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a lateness-risk tier from a task's stored priority score and status.
 * An overdue task is always red, whatever its score.
 */
public class RiskAssessor {

    public static final double RED_THRESHOLD = 0.8;
    public static final double AMBER_THRESHOLD = 0.6;

    static final String HIGH_SCORE_DRIVER = "High priority score indicates urgency";
    static final String MODERATE_SCORE_DRIVER = "Moderate urgency from suspense/prior history";
    static final String OVERDUE_DRIVER = "Task already overdue";
    static final String NO_RISK_DRIVER = "No major risk factors detected";

    public static final List<String> DEFAULT_ACTIONS =
            List.of("Confirm staffing plan", "Send reminder via notification service");

    private final List<String> recommendedActions;

    public RiskAssessor() {
        this(DEFAULT_ACTIONS);
    }

    public RiskAssessor(List<String> recommendedActions) {
        this.recommendedActions = recommendedActions == null || recommendedActions.isEmpty()
                ? DEFAULT_ACTIONS
                : List.copyOf(recommendedActions);
    }

    public RiskInsight assess(TaskSnapshot task) {
        Assert.notNull(task, "task must not be null");

        RiskTier tier = RiskTier.GREEN;
        double lateProbability = 0.2;
        List<String> drivers = new ArrayList<>();

        double score = task.priorityScore();
        if (score >= RED_THRESHOLD) {
            tier = RiskTier.RED;
            lateProbability = 0.75;
            drivers.add(HIGH_SCORE_DRIVER);
        } else if (score >= AMBER_THRESHOLD) {
            tier = RiskTier.AMBER;
            lateProbability = 0.5;
            drivers.add(MODERATE_SCORE_DRIVER);
        }

        // Must stay last: overdue overrides whatever the score decided.
        if (TaskStatus.OVERDUE.matches(task.status())) {
            tier = RiskTier.RED;
            lateProbability = 0.9;
            drivers.add(OVERDUE_DRIVER);
        }

        if (drivers.isEmpty()) {
            drivers.add(NO_RISK_DRIVER);
        }
        return new RiskInsight(task.taskId(), tier, Scores.round2(lateProbability), List.copyOf(drivers),
                recommendedActions);
    }
}
