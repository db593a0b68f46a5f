package com.reqgraph.core.store;

import com.reqgraph.core.WorkspaceTestBase;
import com.reqgraph.core.model.KnowledgeKind;
import com.reqgraph.core.model.KnowledgeRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KnowledgeStore}.
 */
class KnowledgeStoreTest extends WorkspaceTestBase {

    @Test
    void loadAll_readsEveryKindInOrder() throws IOException {
        createFile(".knowledge/lessons.yaml", """
            LES-001:
              name: "Pin schema versions"
            """);
        createFile(".knowledge/patterns.yaml", """
            PAT-001:
              name: "Retry with backoff"
              category: error_handling
              frequency: 7
            PAT-002:
              name: "Config defaults"
              category: configuration
              frequency: "3"
            """);

        List<KnowledgeRecord> records = new KnowledgeStore(tempDir.resolve(".knowledge")).loadAll();

        assertThat(records).extracting(KnowledgeRecord::id).containsExactly("PAT-001", "PAT-002", "LES-001");
        assertThat(records.get(0).category()).isEqualTo("error_handling");
        assertThat(records.get(0).frequency()).isEqualTo(7);
        assertThat(records.get(1).frequency()).isEqualTo(3);
        assertThat(records.get(2).kind()).isEqualTo(KnowledgeKind.LESSON);
        assertThat(records.get(2).frequency()).isZero();
    }

    @Test
    void load_malformedFile_isSkipped() throws IOException {
        createFile(".knowledge/patterns.yaml", "PAT-001: [unclosed\n");
        createFile(".knowledge/decisions.yaml", """
            DEC-001:
              name: "Use YAML"
            DEC-002: "not a mapping"
            """);

        KnowledgeStore store = new KnowledgeStore(tempDir.resolve(".knowledge"));

        assertThat(store.load(KnowledgeKind.PATTERN)).isEmpty();
        assertThat(store.load(KnowledgeKind.DECISION)).extracting(KnowledgeRecord::id).containsExactly("DEC-001");
    }

    @Test
    void save_thenLoad_roundTripsRecords() {
        KnowledgeStore store = new KnowledgeStore(tempDir.resolve(".knowledge"));
        store.open();
        KnowledgeRecord record = new KnowledgeRecord("PAT-010", KnowledgeKind.PATTERN, "testing", 2,
            Map.of("name", "Golden files", "category", "testing", "frequency", 2));

        store.save(KnowledgeKind.PATTERN, List.of(record));

        assertThat(store.load(KnowledgeKind.PATTERN)).containsExactly(record);
    }
}
