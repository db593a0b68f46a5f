package com.reqgraph.core.query;

import com.reqgraph.core.WorkspaceTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureFileCatalogTest extends WorkspaceTestBase {

    @Test
    void hasArtifact_matchesFeatureFilesByUnitNumber() throws IOException {
        createFile("features/uow_001_login.feature", "Feature: Login\n");
        createFile("features/billing/UoW-002-invoices.feature", "Feature: Invoices\n");
        createFile("features/notes.txt", "uow_003\n");

        FeatureFileCatalog catalog = new FeatureFileCatalog(tempDir.resolve("features"));

        assertThat(catalog.coveredUnits()).containsExactlyInAnyOrder("uow-001", "uow-002");
        assertThat(catalog.hasArtifact("UoW-001")).isTrue();
        assertThat(catalog.hasArtifact("UOW_002")).isTrue();
        assertThat(catalog.hasArtifact("UoW-003")).isFalse();
    }

    @Test
    void missingDirectory_coversNothing() {
        FeatureFileCatalog catalog = new FeatureFileCatalog(tempDir.resolve("absent"));

        assertThat(catalog.coveredUnits()).isEmpty();
    }
}
