package com.reqgraph.core.sync;

import com.reqgraph.core.WorkspaceTestBase;
import com.reqgraph.core.model.ConflictResolution;
import com.reqgraph.core.model.ConflictType;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConflictClassifier}.
 */
class ConflictClassifierTest extends WorkspaceTestBase {

    private final ConflictClassifier classifier = new ConflictClassifier("1.0");

    @Test
    void classify_identicalValues_noConflict() {
        Entity fr = entity("FR-001", EntityType.REQUIREMENT, "title", "Login");

        assertThat(classifier.classify(fr, fr, "1.0")).isEmpty();
        assertThat(classifier.classify(null, null, null)).isEmpty();
    }

    @Test
    void classify_otherSchemaVersion_winsOverEverything() {
        Entity fr = entity("FR-001", EntityType.REQUIREMENT, "title", "Login");

        assertThat(classifier.classify(fr, fr, "0.9")).contains(ConflictType.SCHEMA_MISMATCH);
        assertThat(classifier.classify(null, fr, "0.9")).contains(ConflictType.SCHEMA_MISMATCH);
    }

    @Test
    void classify_unknownSchemaVersion_isIgnored() {
        Entity fr = entity("FR-001", EntityType.REQUIREMENT, "title", "Login");

        assertThat(classifier.classify(fr, fr, null)).isEmpty();
        assertThat(classifier.classify(fr, fr, "")).isEmpty();
    }

    @Test
    void classify_valueMissingOnOneSide_isContentDivergence() {
        Entity fr = entity("FR-001", EntityType.REQUIREMENT, "title", "Login");

        assertThat(classifier.classify(null, fr, "1.0")).contains(ConflictType.CONTENT_DIVERGENCE);
        assertThat(classifier.classify(fr, null, "1.0")).contains(ConflictType.CONTENT_DIVERGENCE);
    }

    @Test
    void classify_sameHashDifferentTypeOrSource_isMetadataMismatch() {
        Entity requirement = entity("X-001", EntityType.REQUIREMENT, "title", "Login");
        Entity contract = new Entity("X-001", EntityType.CONTRACT, requirement.attributes(),
            requirement.contentHash(), requirement.source());
        Entity moved = new Entity("X-001", EntityType.REQUIREMENT, requirement.attributes(),
            requirement.contentHash(), "other.yaml");

        assertThat(classifier.classify(requirement, contract, "1.0")).contains(ConflictType.METADATA_MISMATCH);
        assertThat(classifier.classify(requirement, moved, "1.0")).contains(ConflictType.METADATA_MISMATCH);
    }

    @Test
    void classify_onlyReferencesDiffer_isDependencyConflict() {
        Entity authoritative = entity("UOW-101", EntityType.UNIT_OF_WORK,
            "title", "Login service", "implements", List.of("FR-001"), "dependencies", List.of("UOW-100"));
        Entity derived = entity("UOW-101", EntityType.UNIT_OF_WORK,
            "title", "Login service", "implements", List.of("FR-001", "FR-002"));

        assertThat(classifier.classify(authoritative, derived, "1.0")).contains(ConflictType.DEPENDENCY_CONFLICT);
    }

    @Test
    void classify_otherContentDiffers_isContentDivergence() {
        Entity authoritative = entity("UOW-101", EntityType.UNIT_OF_WORK,
            "title", "Login service", "implements", List.of("FR-001"));
        Entity derived = entity("UOW-101", EntityType.UNIT_OF_WORK,
            "title", "Session service", "implements", List.of("FR-002"));

        assertThat(classifier.classify(authoritative, derived, "1.0")).contains(ConflictType.CONTENT_DIVERGENCE);
    }

    @Test
    void resolve_mapsEveryTypeToItsFixedResolution() {
        assertThat(classifier.resolve(ConflictType.METADATA_MISMATCH)).isEqualTo(ConflictResolution.PREFER_AUTHORITATIVE);
        assertThat(classifier.resolve(ConflictType.CONTENT_DIVERGENCE)).isEqualTo(ConflictResolution.MANUAL_REVIEW_REQUIRED);
        assertThat(classifier.resolve(ConflictType.DEPENDENCY_CONFLICT)).isEqualTo(ConflictResolution.MERGE_DEPENDENCIES);
        assertThat(classifier.resolve(ConflictType.SCHEMA_MISMATCH)).isEqualTo(ConflictResolution.UPGRADE_TO_LATEST_SCHEMA);
        assertThat(ConflictClassifier.RESOLUTIONS).containsOnlyKeys(ConflictType.values());
    }
}
