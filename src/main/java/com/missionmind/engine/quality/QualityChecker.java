package com.missionmind.engine.quality;

import com.missionmind.engine.model.QualityCheckResult;
import com.missionmind.engine.model.QualityIssue;
import com.missionmind.engine.model.Severity;
import com.missionmind.engine.model.TaskSnapshot;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every rule against a task and reports all issues found. A task passes when no
 * issue reaches {@link Severity#MEDIUM}.
 */
public class QualityChecker {

    static final Severity FAILING_SEVERITY = Severity.MEDIUM;

    private final List<QualityRule> rules;

    public QualityChecker() {
        this(defaultRules());
    }

    public QualityChecker(List<QualityRule> rules) {
        Assert.notNull(rules, "rules must not be null");
        this.rules = List.copyOf(rules);
    }

    public static List<QualityRule> defaultRules() {
        return List.of(new DescriptionLengthRule(), new RecordSeriesRule());
    }

    public QualityCheckResult check(TaskSnapshot task) {
        Assert.notNull(task, "task must not be null");
        List<QualityIssue> issues = new ArrayList<>();
        for (QualityRule rule : rules) {
            rule.evaluate(task).ifPresent(issues::add);
        }
        boolean passed = issues.stream().noneMatch(issue -> issue.severity().isAtLeast(FAILING_SEVERITY));
        return new QualityCheckResult(task.taskId(), List.copyOf(issues), passed);
    }
}
