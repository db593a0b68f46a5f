package com.reqgraph.core.query;

/**
 * Tells whether a unit of work has a BDD artifact.
 */
@FunctionalInterface
public interface BddArtifactCatalog {

    /**
     * Returns true if at least one BDD artifact exists for the unit of work.
     *
     * @param unitOfWorkId unit-of-work ID, e.g. {@code UoW-001}
     * @return true if covered
     */
    boolean hasArtifact(String unitOfWorkId);

    /**
     * A catalog in which no unit of work has an artifact.
     *
     * @return empty catalog
     */
    static BddArtifactCatalog none() {
        return id -> false;
    }
}
