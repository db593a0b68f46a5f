package com.reqgraph.core.model;

/**
 * Types of directed edges between entities.
 */
public enum RelationshipType {
    /** Unit of work implements a requirement */
    IMPLEMENTS,

    /** Source depends on target */
    DEPENDS_ON,

    /** Extension extends a base entity */
    EXTENDS,

    /** Contract validates the entity it applies to */
    VALIDATES,

    /** Source covers (tests) the target */
    COVERS,

    /** Source is declared to conflict with target */
    CONFLICTS_WITH
}
