package com.missionmind.engine.quality;

import com.missionmind.engine.model.QualityIssue;
import com.missionmind.engine.model.TaskSnapshot;

import java.util.Optional;

/**
 * A single completeness check. Rules are independent of each other.
 */
public interface QualityRule {

    Optional<QualityIssue> evaluate(TaskSnapshot task);
}
