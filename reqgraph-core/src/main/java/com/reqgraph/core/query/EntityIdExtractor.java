package com.reqgraph.core.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds entity-ID-shaped tokens in query text: two to four letters, a hyphen, three or more digits.
 *
 * <p>Matching ignores case so that {@code uow-001} is found as well as {@code UoW-001};
 * callers resolve the token against the graph.
 */
public final class EntityIdExtractor {

    private static final Pattern ENTITY_ID = Pattern.compile("\\b[A-Z]{2,4}-\\d{3,}\\b", Pattern.CASE_INSENSITIVE);

    private EntityIdExtractor() {
        // Utility class
    }

    /**
     * Extracts distinct ID tokens in order of appearance.
     *
     * @param text query text
     * @return ID tokens as written
     */
    public static List<String> extract(String text) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = ENTITY_ID.matcher(text);
        while (matcher.find()) {
            ids.add(matcher.group());
        }
        return new ArrayList<>(ids);
    }
}
