package com.missionmind.engine;

/**
 * One row of the originator priority table. {@code pattern} is matched as a
 * case-insensitive substring of the task originator.
 */
public record OriginatorWeight(String pattern, double weight) {
}
