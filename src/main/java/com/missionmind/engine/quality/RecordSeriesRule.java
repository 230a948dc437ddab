package com.missionmind.engine.quality;

import com.missionmind.engine.model.QualityIssue;
import com.missionmind.engine.model.Severity;
import com.missionmind.engine.model.TaskSnapshot;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Flags tasks without an ARIMS record series.
 */
public class RecordSeriesRule implements QualityRule {

    public static final String CODE = "ARIMS_TAG";

    @Override
    public Optional<QualityIssue> evaluate(TaskSnapshot task) {
        if (StringUtils.hasText(task.recordSeriesId())) {
            return Optional.empty();
        }
        return Optional.of(new QualityIssue(CODE, Severity.LOW,
                "ARIMS record series missing; add before final approval."));
    }
}
