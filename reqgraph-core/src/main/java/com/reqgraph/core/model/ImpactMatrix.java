package com.reqgraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairwise impact levels between a set of entities.
 *
 * @param entityIds entities in the matrix, in request order
 * @param levels source ID to (target ID to impact level), for every ordered pair of distinct IDs
 */
public record ImpactMatrix(
    List<String> entityIds,
    Map<String, Map<String, ImpactLevel>> levels
) {
    /**
     * Compact constructor with validation.
     */
    public ImpactMatrix {
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
        Map<String, Map<String, ImpactLevel>> copy = new LinkedHashMap<>();
        if (levels != null) {
            levels.forEach((source, row) ->
                copy.put(source, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
        }
        levels = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the impact level of {@code source} on {@code target}.
     *
     * @param source source entity ID
     * @param target target entity ID
     * @return impact level, {@link ImpactLevel#NONE} when the pair is absent
     */
    public ImpactLevel level(String source, String target) {
        return levels.getOrDefault(source, Map.of()).getOrDefault(target, ImpactLevel.NONE);
    }
}
