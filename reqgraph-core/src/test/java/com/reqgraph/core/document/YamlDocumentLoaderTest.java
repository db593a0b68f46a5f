package com.reqgraph.core.document;

import com.reqgraph.core.WorkspaceTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link YamlDocumentLoader}.
 */
class YamlDocumentLoaderTest extends WorkspaceTestBase {

    @Test
    void load_standardCorpus_returnsAllRecordsInLoadOrder() throws IOException {
        Path root = writeCorpus();

        DocumentSet documents = new YamlDocumentLoader(root).load();

        assertThat(documents.records())
            .extracting(DocumentRecord::id)
            .containsExactly("FR-001", "FR-002", "FR-003", "NFR-001", "UOW-101", "UOW-102", "UOW-103",
                "CON-002", "CON-001", "security_mfa");
        assertThat(documents.warnings()).isEmpty();
    }

    @Test
    void load_assignsKindsAndSources() throws IOException {
        Path root = writeCorpus();

        DocumentSet documents = new YamlDocumentLoader(root).load();

        assertThat(documents.ofKind(ArtifactKind.QUALITY_ATTRIBUTE))
            .singleElement()
            .satisfies(record -> assertThat(record.source()).isEqualTo("framework-requirements.yaml"));
        assertThat(documents.ofKind(ArtifactKind.CONTRACT))
            .extracting(DocumentRecord::source)
            .containsExactly("contracts/legacy-contract.yaml", "contracts/login-contract.yaml");
        assertThat(documents.ofKind(ArtifactKind.EXTENSION))
            .singleElement()
            .satisfies(record -> assertThat(record.source()).isEqualTo("extensions/security/mfa.yaml"));
    }

    @Test
    void load_listSections_useIdField() throws IOException {
        createFile("framework-requirements.yaml", """
            functional_requirements:
              - id: FR-010
                title: "Listed requirement"
              - title: "No id"
            """);

        DocumentSet documents = new YamlDocumentLoader(tempDir).load();

        assertThat(documents.records()).extracting(DocumentRecord::id).containsExactly("FR-010", "");
    }

    @Test
    void load_contractWithoutContractId_usesFileName() throws IOException {
        createFile("contracts/payments/refund.yml", "title: Refund\n");

        DocumentSet documents = new YamlDocumentLoader(tempDir).load();

        assertThat(documents.records()).extracting(DocumentRecord::id).containsExactly("refund");
    }

    @Test
    void load_extensionOutsideCategory_isIgnored() throws IOException {
        createFile("extensions/loose.yaml", "title: Loose\n");
        createFile("extensions/perf/caching.yaml", "title: Caching\n");

        DocumentSet documents = new YamlDocumentLoader(tempDir).load();

        assertThat(documents.records()).extracting(DocumentRecord::id).containsExactly("perf_caching");
    }

    @Test
    void load_unparseableDocument_becomesWarning() throws IOException {
        createFile("framework-requirements.yaml", """
            functional_requirements:
              FR-001:
                title: "Fine"
            """);
        createFile("contracts/broken.yaml", "applies_to: [unclosed\n");

        DocumentSet documents = new YamlDocumentLoader(tempDir).load();

        assertThat(documents.records()).extracting(DocumentRecord::id).containsExactly("FR-001");
        assertThat(documents.warnings())
            .singleElement()
            .asString()
            .contains("contracts/broken.yaml");
    }

    @Test
    void load_emptyRoot_returnsEmptySet() {
        DocumentSet documents = new YamlDocumentLoader(tempDir.resolve("missing")).load();

        assertThat(documents.records()).isEmpty();
        assertThat(documents.warnings()).isEmpty();
    }
}
