package com.reqgraph.core;

import com.reqgraph.core.graph.RequirementGraph;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RelationshipType;
import com.reqgraph.core.util.ContentHasher;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for tests working on a document corpus or an in-memory graph.
 *
 * <p>{@link #writeCorpus()} creates a small but complete corpus:
 * <ul>
 *   <li>FR-001 implemented by UOW-101 and UOW-102, extended by security_mfa</li>
 *   <li>FR-002 implemented by UOW-103, which depends on UOW-101 and the missing UOW-999</li>
 *   <li>FR-003 with no implementation</li>
 *   <li>CON-001 validating UOW-101, CON-002 validating the missing UOW-404</li>
 *   <li>a feature file for UOW-101 only</li>
 * </ul>
 */
public abstract class WorkspaceTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Writes the standard corpus under {@code docs/ssot} and {@code features}.
     *
     * @return document root
     * @throws IOException if a file cannot be created
     */
    protected Path writeCorpus() throws IOException {
        createFile("docs/ssot/framework-requirements.yaml", """
            functional_requirements:
              FR-001:
                title: "User authentication"
                description: "Users authenticate with username and password"
                priority: critical
                layer: application
                acceptance_criteria:
                  - "Valid credentials grant a session"
                  - "Invalid credentials are rejected"
              FR-002:
                title: "Audit logging"
                description: "Every authentication attempt is written to the audit log"
                priority: high
                layer: foundation
              FR-003:
                title: "Report export"
                description: "Reports can be exported as CSV"
                priority: low
            non_functional_requirements:
              NFR-001:
                title: "Login latency"
                description: "Authentication completes within 200 ms"
            units_of_work:
              UOW-101:
                title: "Login service"
                implements: [FR-001, NFR-001]
                layer: application
              UOW-102:
                title: "Session store"
                implements: FR-001
                dependencies: [UOW-101]
                layer: foundation
              UOW-103:
                title: "Audit writer"
                implements: [FR-002]
                dependencies: [UOW-101, UOW-999]
                layer: deployment
            """);
        createFile("docs/ssot/contracts/login-contract.yaml", """
            contract_id: CON-001
            title: "Login contract"
            applies_to:
              entity_name: UOW-101
            """);
        createFile("docs/ssot/contracts/legacy-contract.yaml", """
            contract_id: CON-002
            title: "Legacy contract"
            applies_to: UOW-404
            """);
        createFile("docs/ssot/extensions/security/mfa.yaml", """
            title: "Multi-factor authentication"
            extends: FR-001
            """);
        createFile("features/uow_101_login.feature", """
            Feature: Login
              Scenario: Valid credentials
            """);
        return tempDir.resolve("docs/ssot");
    }

    /**
     * Creates an entity with the given attributes.
     *
     * @param id entity ID
     * @param type entity type
     * @param keyValues alternating attribute names and values
     * @return entity
     */
    protected static Entity entity(String id, EntityType type, Object... keyValues) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            attributes.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Entity(id, type, attributes, ContentHasher.hash(attributes), "test.yaml");
    }

    protected static Relationship relationship(String source, String target, RelationshipType type) {
        return new Relationship(source, target, type, Map.of());
    }

    protected static RequirementGraph graph(List<Entity> entities, Relationship... relationships) {
        return new RequirementGraph(entities, Arrays.asList(relationships));
    }
}
