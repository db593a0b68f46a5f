package com.reqgraph.core.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.reqgraph.core.exception.InvalidInputException;

import java.util.Locale;
import java.util.Map;

/**
 * Query types accepted by {@link QueryEngine}. {@link #AUTO} detects the type from the query text.
 */
public enum QueryType {
    AUTO,
    KEYWORD,
    RELATIONSHIP,
    PATTERN,
    IMPACT,
    COVERAGE,
    GAP;

    /**
     * Parses a query type name case-insensitively.
     *
     * @param value type name such as {@code "gap"}
     * @return query type
     * @throws InvalidInputException if the name is unknown
     */
    public static QueryType parse(String value) {
        if (value != null) {
            for (QueryType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidInputException("Unknown query type: " + value,
            Map.of("operation", "query", "queryType", String.valueOf(value)));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
