package com.missionmind.engine;

import com.missionmind.engine.model.RiskTier;
import com.missionmind.engine.model.TaskSnapshot;
import com.missionmind.engine.model.TaskSummary;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.List;

/**
 * Template-based task summary. Highlights urgency, the deadline, leading tags and the
 * first comment. Uses coarser risk bands than {@link RiskAssessor}.
 */
public class TaskSummarizer {

    static final double HIGH_PRIORITY = 0.8;
    static final double ELEVATED_PRIORITY = 0.5;
    static final int MAX_TAGS = 3;
    static final int SNIPPET_LENGTH = 80;

    public TaskSummary summarize(TaskSnapshot task, List<String> comments) {
        Assert.notNull(task, "task must not be null");

        List<String> keyPoints = new ArrayList<>();
        if (task.priorityScore() >= HIGH_PRIORITY) {
            keyPoints.add("High priority task");
        }
        if (task.suspenseDate() != null) {
            keyPoints.add("Due " + task.suspenseDate());
        }
        if (!task.tags().isEmpty()) {
            keyPoints.add("Tags: " + String.join(", ", task.tags().subList(0, Math.min(MAX_TAGS, task.tags().size()))));
        }
        if (comments != null && !comments.isEmpty() && comments.get(0) != null) {
            String first = comments.get(0);
            keyPoints.add("Recent feedback snippets: " + first.substring(0, Math.min(SNIPPET_LENGTH, first.length())) + "...");
        }

        String summary = "Task %s from %s focuses on %s. Classification %s. Priority score %s.".formatted(
                task.taskId(), task.originator(), task.title(), task.classification().value(), task.priorityScore());
        return new TaskSummary(summary, riskLevel(task.priorityScore()), List.copyOf(keyPoints));
    }

    private static RiskTier riskLevel(double score) {
        if (score >= HIGH_PRIORITY) {
            return RiskTier.RED;
        }
        if (score >= ELEVATED_PRIORITY) {
            return RiskTier.AMBER;
        }
        return RiskTier.GREEN;
    }
}
