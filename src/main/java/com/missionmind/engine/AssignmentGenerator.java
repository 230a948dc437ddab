package com.missionmind.engine;

import com.missionmind.engine.model.AssigneeType;
import com.missionmind.engine.model.AssignmentRecord;
import com.missionmind.engine.model.RoutingRecommendation;
import com.missionmind.engine.model.TaskSnapshot;
import org.springframework.util.Assert;

/**
 * Builds the pending ownership assignment created alongside every new task.
 */
public class AssignmentGenerator {

    public static final String OWNER_ROLE = "owner";
    public static final String PENDING_STATE = "pending";

    private final RoutingRecommender routingRecommender;

    public AssignmentGenerator(RoutingRecommender routingRecommender) {
        Assert.notNull(routingRecommender, "routingRecommender must not be null");
        this.routingRecommender = routingRecommender;
    }

    public AssignmentRecord generate(TaskSnapshot task, OrgHierarchyReader hierarchyReader) {
        RoutingRecommendation recommendation = routingRecommender.recommend(task, hierarchyReader);
        return new AssignmentRecord(
                task.taskId(),
                AssigneeType.ORGANIZATION,
                recommendation.orgUnitId(),
                OWNER_ROLE,
                PENDING_STATE,
                recommendation.rationale());
    }
}
