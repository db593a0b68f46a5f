package com.reqgraph.core.query;

import java.util.List;

/**
 * Classifies query text into a {@link QueryType} with an ordered rule table.
 *
 * <p>Rules are evaluated top to bottom and the first match wins; text matching no rule
 * is a keyword query. Substring matching means {@code "coverage"} selects the relationship
 * rule through {@code "cover"}.
 */
public final class QueryIntentDetector {

    /** Detection rules in priority order. */
    public static final List<IntentRule> RULES = List.of(
        new IntentRule(QueryType.IMPACT, List.of("impact", "affect", "change")),
        new IntentRule(QueryType.RELATIONSHIP, List.of("implement", "cover", "relate")),
        new IntentRule(QueryType.PATTERN, List.of("pattern", "frequent", "common")),
        new IntentRule(QueryType.GAP, List.of("gap", "missing", "without")),
        new IntentRule(QueryType.COVERAGE, List.of("coverage", "complete"))
    );

    private QueryIntentDetector() {
        // Utility class
    }

    /**
     * Detects the query type of {@code queryText}.
     *
     * @param queryText non-empty query text
     * @return first matching rule's type, or {@link QueryType#KEYWORD}
     */
    public static QueryType detect(String queryText) {
        for (IntentRule rule : RULES) {
            if (rule.matches(queryText)) {
                return rule.type();
            }
        }
        return QueryType.KEYWORD;
    }
}
