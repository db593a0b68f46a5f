package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Coverage gaps over the whole graph.
 *
 * @param requirementsWithoutUows requirements with no incoming {@code IMPLEMENTS} edge
 * @param uowsWithoutContracts units of work no contract applies to
 * @param uowsWithoutBdd units of work with no BDD artifact
 * @param orphanedContracts contracts whose {@code applies_to} target does not resolve
 */
public record CoverageReport(
    @JsonProperty("requirements_without_uows") List<String> requirementsWithoutUows,
    @JsonProperty("uows_without_contracts") List<String> uowsWithoutContracts,
    @JsonProperty("uows_without_bdd") List<String> uowsWithoutBdd,
    @JsonProperty("orphaned_contracts") List<String> orphanedContracts
) {
    /**
     * Compact constructor with validation.
     */
    public CoverageReport {
        requirementsWithoutUows = requirementsWithoutUows == null ? List.of() : List.copyOf(requirementsWithoutUows);
        uowsWithoutContracts = uowsWithoutContracts == null ? List.of() : List.copyOf(uowsWithoutContracts);
        uowsWithoutBdd = uowsWithoutBdd == null ? List.of() : List.copyOf(uowsWithoutBdd);
        orphanedContracts = orphanedContracts == null ? List.of() : List.copyOf(orphanedContracts);
    }

    /**
     * Returns the total number of gaps across all categories.
     *
     * @return gap count
     */
    public int gapCount() {
        return requirementsWithoutUows.size() + uowsWithoutContracts.size()
            + uowsWithoutBdd.size() + orphanedContracts.size();
    }
}
