package com.reqgraph.core.query;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One row of the intent-detection table: a query type and the substrings that select it.
 *
 * @param type query type selected by this rule
 * @param tokens lower-case substrings, any of which selects the rule
 */
public record IntentRule(
    QueryType type,
    List<String> tokens
) {
    /**
     * Compact constructor with validation.
     */
    public IntentRule {
        Objects.requireNonNull(type, "type must not be null");
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /**
     * Returns true if the query text contains any of this rule's tokens, ignoring case.
     *
     * @param queryText query text
     * @return true on match
     */
    public boolean matches(String queryText) {
        String lower = queryText.toLowerCase(Locale.ROOT);
        return tokens.stream().anyMatch(lower::contains);
    }
}
