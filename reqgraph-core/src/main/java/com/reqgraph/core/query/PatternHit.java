package com.reqgraph.core.query;

import com.reqgraph.core.model.KnowledgeRecord;

import java.util.Objects;

/**
 * Learned pattern returned by a pattern query. Relevance is the pattern's frequency.
 *
 * @param pattern pattern record
 */
public record PatternHit(
    KnowledgeRecord pattern
) implements QueryHit {
    /**
     * Compact constructor with validation.
     */
    public PatternHit {
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    public int relevance() {
        return pattern.frequency();
    }

    @Override
    public String summary() {
        return pattern.id() + " " + pattern.name() + " [" + pattern.category() + "] x" + pattern.frequency();
    }
}
