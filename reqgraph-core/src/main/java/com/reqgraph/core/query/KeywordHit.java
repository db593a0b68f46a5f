package com.reqgraph.core.query;

import com.reqgraph.core.model.Entity;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Requirement matched by a keyword query.
 *
 * @param entity matched requirement
 * @param relevance token occurrences divided by word count of the searchable text
 * @param matches fields containing the token, as {@code "title: ..."} or {@code "description: ..."}
 */
public record KeywordHit(
    Entity entity,
    double relevance,
    List<String> matches
) implements QueryHit {
    /**
     * Compact constructor with validation.
     */
    public KeywordHit {
        Objects.requireNonNull(entity, "entity must not be null");
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    @Override
    public String summary() {
        return String.format(Locale.ROOT, "%s %s (relevance %.3f)", entity.id(), entity.displayName(), relevance);
    }
}
