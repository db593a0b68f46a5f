package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pairwise impact level in an impact matrix, derived from shortest-path length.
 */
public enum ImpactLevel {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    /**
     * Maps a shortest-path length in edges to an impact level.
     *
     * @param distance edge count, or a negative value when unreachable
     * @return 1 edge high, 2 edges medium, 3 or more low, unreachable none
     */
    public static ImpactLevel fromDistance(int distance) {
        if (distance < 1) {
            return NONE;
        }
        if (distance == 1) {
            return HIGH;
        }
        return distance == 2 ? MEDIUM : LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
