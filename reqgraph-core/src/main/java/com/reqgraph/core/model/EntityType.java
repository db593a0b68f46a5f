package com.reqgraph.core.model;

/**
 * Types of nodes in the requirements graph.
 *
 * <p>The first five types are derived from authoritative documents. {@link #PATTERN},
 * {@link #DECISION} and {@link #LESSON} are derived-knowledge types accumulated through
 * usage and promoted back into the authoritative store by the sync engine.
 */
public enum EntityType {
    /** Functional requirement */
    REQUIREMENT("functional_requirement"),

    /** Non-functional requirement (quality attribute) */
    QUALITY_ATTRIBUTE("non_functional_requirement"),

    /** Unit of work implementing one or more requirements */
    UNIT_OF_WORK("unit_of_work"),

    /** Design-by-contract definition applying to another entity */
    CONTRACT("contract"),

    /** Domain extension bundle */
    EXTENSION("extension"),

    /** Learned pattern */
    PATTERN("pattern"),

    /** Architecture decision */
    DECISION("decision"),

    /** Lesson learned */
    LESSON("lesson");

    private final String code;

    EntityType(String code) {
        this.code = code;
    }

    /**
     * Returns the lower-case code used in summaries and sync logs.
     *
     * @return type code
     */
    public String code() {
        return code;
    }

    /**
     * Returns true for requirement-kind types searched by keyword queries and
     * checked by coverage analysis.
     *
     * @return true for {@link #REQUIREMENT} and {@link #QUALITY_ATTRIBUTE}
     */
    public boolean requirementKind() {
        return this == REQUIREMENT || this == QUALITY_ATTRIBUTE;
    }

    /**
     * Returns true for types accumulated on the derived side.
     *
     * @return true for patterns, decisions and lessons
     */
    public boolean derivedKnowledge() {
        return this == PATTERN || this == DECISION || this == LESSON;
    }
}
