package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.reqgraph.core.exception.InvalidInputException;

import java.util.Locale;
import java.util.Map;

/**
 * Kind of change being analyzed, with its contribution to impact severity.
 */
public enum ChangeType {
    MODIFICATION(0),
    MAJOR_MODIFICATION(1),
    REMOVAL(2);

    private final int weight;

    ChangeType(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Parses {@code modification}, {@code major_modification} or {@code removal}
     * (case-insensitive, hyphens accepted).
     *
     * @param value change type text
     * @return change type
     * @throws InvalidInputException if the value is not a known change type
     */
    @JsonCreator
    public static ChangeType parse(String value) {
        if (value != null) {
            String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (ChangeType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidInputException("Unknown change type: " + value,
            Map.of("operation", "impact", "changeType", String.valueOf(value)));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
