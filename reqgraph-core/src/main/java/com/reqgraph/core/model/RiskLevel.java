package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall risk of a change, derived from the aggregated risk score.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps a risk score to a level: 8 and above critical, 5 and above high,
     * 3 and above medium, otherwise low.
     *
     * @param score aggregated risk score
     * @return risk level
     */
    public static RiskLevel fromScore(int score) {
        if (score >= 8) {
            return CRITICAL;
        }
        if (score >= 5) {
            return HIGH;
        }
        if (score >= 3) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean requiresMitigation() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
