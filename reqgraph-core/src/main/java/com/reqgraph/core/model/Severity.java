package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.reqgraph.core.exception.DataValidationException;

import java.util.Locale;
import java.util.Map;

/**
 * Severity of a single impact item, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps an additive severity score to a bucket: below 2 is low, 2-3 medium,
     * 4-5 high, 6 and above critical.
     *
     * @param score additive score
     * @return severity bucket
     */
    public static Severity fromScore(int score) {
        if (score >= 6) {
            return CRITICAL;
        }
        if (score >= 4) {
            return HIGH;
        }
        if (score >= 2) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Returns the severity one level lower, floored at {@link #LOW}.
     *
     * @return reduced severity
     */
    public Severity reduced() {
        return this == LOW ? LOW : values()[ordinal() - 1];
    }

    /**
     * Parses a severity label case-insensitively.
     *
     * @param label severity label such as {@code "high"}
     * @return severity
     * @throws DataValidationException if the label is not a known severity
     */
    @JsonCreator
    public static Severity parse(String label) {
        if (label != null) {
            for (Severity severity : values()) {
                if (severity.name().equalsIgnoreCase(label.trim())) {
                    return severity;
                }
            }
        }
        throw new DataValidationException("Unrecognized severity: " + label,
            Map.of("field", "severity", "value", String.valueOf(label)));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
