package com.missionmind.config;

import com.missionmind.engine.AuthorityResolver;
import com.missionmind.engine.EngineTables;
import com.missionmind.engine.OriginatorWeight;
import com.missionmind.engine.RiskAssessor;
import com.missionmind.engine.model.TaskStatus;

import java.util.*;

/**
 * Tunables for the prioritization, routing and authority rules.
 * Empty tables fall back to the built-in defaults; a table that is configured replaces
 * the default entirely rather than merging with it.
 */
public class EngineProperties {

    /**
     * Keyword to section (org unit code) map. Declaration order is the matching order.
     */
    private Map<String, String> keywordSections = new LinkedHashMap<>();

    /**
     * Originator priority table. The first pattern contained in the originator wins.
     */
    private List<OriginatorWeightEntry> originatorWeights = new ArrayList<>();

    private double defaultOriginatorWeight = EngineTables.DEFAULT_ORIGINATOR_WEIGHT;

    private Map<TaskStatus, Double> statusWeights = new EnumMap<>(TaskStatus.class);

    private double defaultStatusWeight = EngineTables.DEFAULT_STATUS_WEIGHT;

    /**
     * Default number of authority suggestions returned.
     */
    private int suggestionLimit = AuthorityResolver.DEFAULT_LIMIT;

    /**
     * Upper bound on ancestor tiers walked when resolving authorities.
     */
    private int maxHierarchyDepth = AuthorityResolver.DEFAULT_MAX_DEPTH;

    /**
     * Minimum description length before the quality check flags it.
     */
    private int minDescriptionLength = 30;

    private List<String> recommendedActions = new ArrayList<>(RiskAssessor.DEFAULT_ACTIONS);

    public static class OriginatorWeightEntry {
        private String pattern;
        private double weight;

        public OriginatorWeightEntry() {}

        public OriginatorWeightEntry(String pattern, double weight) {
            this.pattern = pattern;
            this.weight = weight;
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }
    }

    public EngineTables toTables() {
        Map<String, String> keywords = keywordSections.isEmpty()
                ? EngineTables.defaultKeywordSections()
                : keywordSections;
        List<OriginatorWeight> originators = originatorWeights.isEmpty()
                ? EngineTables.defaultOriginatorWeights()
                : originatorWeights.stream()
                        .filter(entry -> entry.getPattern() != null && !entry.getPattern().isBlank())
                        .map(entry -> new OriginatorWeight(entry.getPattern(), entry.getWeight()))
                        .toList();
        Map<TaskStatus, Double> statuses = statusWeights.isEmpty()
                ? EngineTables.defaultStatusWeights()
                : statusWeights;
        return new EngineTables(keywords, originators, defaultOriginatorWeight, statuses, defaultStatusWeight);
    }

    public Map<String, String> getKeywordSections() { return keywordSections; }
    public void setKeywordSections(Map<String, String> keywordSections) {
        this.keywordSections = keywordSections != null ? new LinkedHashMap<>(keywordSections) : new LinkedHashMap<>();
    }

    public List<OriginatorWeightEntry> getOriginatorWeights() { return originatorWeights; }
    public void setOriginatorWeights(List<OriginatorWeightEntry> originatorWeights) {
        this.originatorWeights = originatorWeights != null ? new ArrayList<>(originatorWeights) : new ArrayList<>();
    }

    public double getDefaultOriginatorWeight() { return defaultOriginatorWeight; }
    public void setDefaultOriginatorWeight(double defaultOriginatorWeight) { this.defaultOriginatorWeight = defaultOriginatorWeight; }

    public Map<TaskStatus, Double> getStatusWeights() { return statusWeights; }
    public void setStatusWeights(Map<TaskStatus, Double> statusWeights) {
        this.statusWeights = statusWeights != null ? new EnumMap<>(statusWeights) : new EnumMap<>(TaskStatus.class);
    }

    public double getDefaultStatusWeight() { return defaultStatusWeight; }
    public void setDefaultStatusWeight(double defaultStatusWeight) { this.defaultStatusWeight = defaultStatusWeight; }

    public int getSuggestionLimit() { return suggestionLimit; }
    public void setSuggestionLimit(int suggestionLimit) {
        if (suggestionLimit > 0) {
            this.suggestionLimit = suggestionLimit;
        }
    }

    public int getMaxHierarchyDepth() { return maxHierarchyDepth; }
    public void setMaxHierarchyDepth(int maxHierarchyDepth) {
        if (maxHierarchyDepth > 0) {
            this.maxHierarchyDepth = maxHierarchyDepth;
        }
    }

    public int getMinDescriptionLength() { return minDescriptionLength; }
    public void setMinDescriptionLength(int minDescriptionLength) { this.minDescriptionLength = minDescriptionLength; }

    public List<String> getRecommendedActions() { return recommendedActions; }
    public void setRecommendedActions(List<String> recommendedActions) {
        if (recommendedActions == null || recommendedActions.isEmpty()) {
            return;
        }
        this.recommendedActions = new ArrayList<>(recommendedActions);
    }
}
