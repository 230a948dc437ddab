package com.missionmind.config;

import com.missionmind.engine.AssignmentGenerator;
import com.missionmind.engine.AuthorityResolver;
import com.missionmind.engine.EngineTables;
import com.missionmind.engine.PriorityScorer;
import com.missionmind.engine.RiskAssessor;
import com.missionmind.engine.RoutingRecommender;
import com.missionmind.engine.TaskSummarizer;
import com.missionmind.engine.quality.DescriptionLengthRule;
import com.missionmind.engine.quality.QualityChecker;
import com.missionmind.engine.quality.RecordSeriesRule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public EngineTables engineTables(MissionMindProperties properties) {
        return properties.getEngine().toTables();
    }

    @Bean
    public PriorityScorer priorityScorer(EngineTables engineTables) {
        return new PriorityScorer(engineTables);
    }

    @Bean
    public RoutingRecommender routingRecommender(EngineTables engineTables) {
        return new RoutingRecommender(engineTables);
    }

    @Bean
    public AssignmentGenerator assignmentGenerator(RoutingRecommender routingRecommender) {
        return new AssignmentGenerator(routingRecommender);
    }

    @Bean
    public AuthorityResolver authorityResolver(MissionMindProperties properties) {
        EngineProperties engine = properties.getEngine();
        return new AuthorityResolver(engine.getSuggestionLimit(), engine.getMaxHierarchyDepth());
    }

    @Bean
    public RiskAssessor riskAssessor(MissionMindProperties properties) {
        return new RiskAssessor(properties.getEngine().getRecommendedActions());
    }

    @Bean
    public QualityChecker qualityChecker(MissionMindProperties properties) {
        return new QualityChecker(List.of(
                new DescriptionLengthRule(properties.getEngine().getMinDescriptionLength()),
                new RecordSeriesRule()));
    }

    @Bean
    public TaskSummarizer taskSummarizer() {
        return new TaskSummarizer();
    }
}
