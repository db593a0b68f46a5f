package com.reqgraph.core.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered keyword-to-category table used by pattern queries.
 */
public final class PatternCategories {

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("error", "error_handling");
        defaults.put("validation", "data_validation");
        defaults.put("config", "configuration");
        defaults.put("test", "testing");
        defaults.put("performance", "performance");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> table;

    private PatternCategories(Map<String, String> table) {
        this.table = table;
    }

    public static PatternCategories defaults() {
        return new PatternCategories(DEFAULTS);
    }

    /**
     * Creates a table from configuration, falling back to the defaults when empty.
     *
     * @param table keyword to category, in evaluation order
     * @return pattern categories
     */
    public static PatternCategories of(Map<String, String> table) {
        if (table == null || table.isEmpty()) {
            return defaults();
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        table.forEach((keyword, category) -> normalized.put(keyword.toLowerCase(Locale.ROOT), category));
        return new PatternCategories(Collections.unmodifiableMap(normalized));
    }

    public Map<String, String> table() {
        return table;
    }

    /**
     * Returns the category of the first keyword contained in the text.
     *
     * @param queryText query text
     * @return category, empty when no keyword matches
     */
    public Optional<String> categoryFor(String queryText) {
        String lower = queryText.toLowerCase(Locale.ROOT);
        return table.entrySet().stream()
            .filter(entry -> lower.contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
