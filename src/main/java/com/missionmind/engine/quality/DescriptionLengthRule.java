package com.missionmind.engine.quality;

import com.missionmind.engine.model.QualityIssue;
import com.missionmind.engine.model.Severity;
import com.missionmind.engine.model.TaskSnapshot;

import java.util.Optional;

public class DescriptionLengthRule implements QualityRule {

    public static final String CODE = "DESC_LEN";
    public static final int DEFAULT_MIN_LENGTH = 30;

    private final int minLength;

    public DescriptionLengthRule() {
        this(DEFAULT_MIN_LENGTH);
    }

    public DescriptionLengthRule(int minLength) {
        this.minLength = minLength;
    }

    @Override
    public Optional<QualityIssue> evaluate(TaskSnapshot task) {
        if (task.description().length() >= minLength) {
            return Optional.empty();
        }
        return Optional.of(new QualityIssue(CODE, Severity.MEDIUM,
                "Description is brief; Army 25-50 recommends more context."));
    }
}
