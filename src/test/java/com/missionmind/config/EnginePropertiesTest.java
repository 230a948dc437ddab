package com.missionmind.config;

import com.missionmind.engine.EngineTables;
import com.missionmind.engine.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnginePropertiesTest {

    @Test
    void testEmptyTablesFallBackToDefaults() {
        EngineTables tables = new EngineProperties().toTables();

        assertEquals(EngineTables.defaultKeywordSections(), tables.keywordSections());
        assertEquals(EngineTables.defaultOriginatorWeights(), tables.originatorWeights());
        assertEquals(0.6, tables.statusWeight("in_work"));
    }

    @Test
    void testConfiguredTablesReplaceDefaults() {
        EngineProperties properties = new EngineProperties();
        Map<String, String> keywords = new LinkedHashMap<>();
        keywords.put("cyber", "G6_CIO");
        properties.setKeywordSections(keywords);
        properties.setOriginatorWeights(List.of(
                new EngineProperties.OriginatorWeightEntry("JOINT STAFF", 1.0),
                new EngineProperties.OriginatorWeightEntry(" ", 0.9)));
        properties.setStatusWeights(Map.of(TaskStatus.OPEN, 0.9));
        properties.setDefaultStatusWeight(0.1);

        EngineTables tables = properties.toTables();

        assertEquals(List.of("cyber"), List.copyOf(tables.keywordSections().keySet()));
        assertEquals(1, tables.originatorWeights().size());
        assertEquals(1.0, tables.originatorWeight("Joint Staff J3"));
        assertEquals(0.6, tables.originatorWeight("HQDA"));
        assertEquals(0.9, tables.statusWeight("open"));
        assertEquals(0.1, tables.statusWeight("draft"));
    }

    @Test
    void testInvalidLimitsAreIgnored() {
        EngineProperties properties = new EngineProperties();
        properties.setSuggestionLimit(0);
        properties.setMaxHierarchyDepth(-1);
        properties.setRecommendedActions(List.of());

        assertEquals(3, properties.getSuggestionLimit());
        assertEquals(16, properties.getMaxHierarchyDepth());
        assertEquals(2, properties.getRecommendedActions().size());
    }
}
