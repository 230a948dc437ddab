package com.missionmind.engine;

import com.missionmind.engine.model.TaskStatus;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables shared by the scoring and routing rules. Iteration order of the keyword
 * map and the originator list is significant: the first match wins.
 */
public final class EngineTables {

    public static final double DEFAULT_ORIGINATOR_WEIGHT = 0.6;
    public static final double DEFAULT_STATUS_WEIGHT = 0.5;

    private final Map<String, String> keywordSections;
    private final List<OriginatorWeight> originatorWeights;
    private final double defaultOriginatorWeight;
    private final Map<TaskStatus, Double> statusWeights;
    private final double defaultStatusWeight;

    public EngineTables(Map<String, String> keywordSections,
                        List<OriginatorWeight> originatorWeights,
                        double defaultOriginatorWeight,
                        Map<TaskStatus, Double> statusWeights,
                        double defaultStatusWeight) {
        Map<String, String> keywords = new LinkedHashMap<>();
        if (keywordSections != null) {
            keywordSections.forEach((keyword, section) -> {
                if (keyword != null && !keyword.isBlank() && section != null) {
                    keywords.put(keyword.trim().toLowerCase(Locale.ROOT), section);
                }
            });
        }
        this.keywordSections = Collections.unmodifiableMap(keywords);
        this.originatorWeights = originatorWeights == null ? List.of() : List.copyOf(originatorWeights);
        this.defaultOriginatorWeight = defaultOriginatorWeight;
        Map<TaskStatus, Double> statuses = new EnumMap<>(TaskStatus.class);
        if (statusWeights != null) {
            statuses.putAll(statusWeights);
        }
        this.statusWeights = Collections.unmodifiableMap(statuses);
        this.defaultStatusWeight = defaultStatusWeight;
    }

    public static EngineTables defaults() {
        return new EngineTables(defaultKeywordSections(), defaultOriginatorWeights(), DEFAULT_ORIGINATOR_WEIGHT,
                defaultStatusWeights(), DEFAULT_STATUS_WEIGHT);
    }

    public static Map<String, String> defaultKeywordSections() {
        Map<String, String> keywords = new LinkedHashMap<>();
        keywords.put("readiness", "OPS_G3");
        keywords.put("training", "OPS_G3");
        keywords.put("intel", "INTEL_G2");
        keywords.put("logistics", "LOG_G4");
        keywords.put("personnel", "PERS_G1");
        keywords.put("legal", "JA");
        keywords.put("chaplain", "CHAP");
        keywords.put("communications", "G6_CIO");
        return keywords;
    }

    public static List<OriginatorWeight> defaultOriginatorWeights() {
        return List.of(
                new OriginatorWeight("HQDA", 1.0),
                new OriginatorWeight("ACOM", 0.85),
                new OriginatorWeight("ASCC", 0.8),
                new OriginatorWeight("DRU", 0.75));
    }

    public static Map<TaskStatus, Double> defaultStatusWeights() {
        Map<TaskStatus, Double> weights = new EnumMap<>(TaskStatus.class);
        weights.put(TaskStatus.DRAFT, 0.4);
        weights.put(TaskStatus.IN_WORK, 0.6);
        weights.put(TaskStatus.OPEN, 0.7);
        weights.put(TaskStatus.OVERDUE, 1.0);
        return weights;
    }

    public Map<String, String> keywordSections() {
        return keywordSections;
    }

    public List<OriginatorWeight> originatorWeights() {
        return originatorWeights;
    }

    /**
     * Keywords contained in the (already lower-cased) text, in table order.
     */
    public List<String> matchingKeywords(String text) {
        List<String> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matches;
        }
        for (String keyword : keywordSections.keySet()) {
            if (text.contains(keyword)) {
                matches.add(keyword);
            }
        }
        return matches;
    }

    @Nullable
    public String sectionFor(String keyword) {
        return keywordSections.get(keyword);
    }

    public double originatorWeight(String originator) {
        if (originator == null || originator.isBlank()) {
            return defaultOriginatorWeight;
        }
        String upper = originator.toUpperCase(Locale.ROOT);
        for (OriginatorWeight row : originatorWeights) {
            if (row.pattern() != null && upper.contains(row.pattern().toUpperCase(Locale.ROOT))) {
                return row.weight();
            }
        }
        return defaultOriginatorWeight;
    }

    public double statusWeight(String status) {
        Optional<TaskStatus> known = TaskStatus.fromValue(status);
        return known.map(statusWeights::get).orElse(defaultStatusWeight);
    }
}
