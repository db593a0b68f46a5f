package com.reqgraph;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the command line against a small workspace.
 */
@DisplayName("ReqGraph CLI")
class ReqGraphCLITest {

    @TempDir
    Path workspace;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));

        write("docs/ssot/framework-requirements.yaml", """
            functional_requirements:
              FR-001:
                title: "User authentication"
                description: "Users authenticate with username and password"
                priority: critical
                layer: application
              FR-002:
                title: "Audit logging"
                description: "Authentication attempts are audited"
            units_of_work:
              UOW-101:
                title: "Login service"
                implements: [FR-001]
                layer: application
            """);
        write("docs/ssot/contracts/login-contract.yaml", """
            contract_id: CON-001
            title: "Login contract"
            applies_to: UOW-101
            """);
        write("features/uow_101_login.feature", "Feature: Login\n");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    @DisplayName("Should print banner without a subcommand")
    void noSubcommand_printsBanner() {
        int exitCode = run();

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("ReqGraph - Requirements graph engine");
    }

    @Test
    @DisplayName("Should index the workspace documents")
    void index_writesIndex() {
        int exitCode = run("index", "-d", workspace.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Indexed 4 entities, 2 relationships");
        assertThat(workspace.resolve("docs/ssot/.index/entities.json")).exists();
        assertThat(workspace.resolve("docs/ssot/.index/metadata.json")).exists();
    }

    @Test
    @DisplayName("Should answer keyword queries from the index")
    void query_keyword_listsMatches() {
        run("index", "-d", workspace.toString());

        int exitCode = run("query", "-d", workspace.toString(), "-t", "keyword", "authentication");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Type: keyword").contains("FR-001");
    }

    @Test
    @DisplayName("Should reject unknown query types")
    void query_unknownType_fails() {
        int exitCode = run("query", "-d", workspace.toString(), "-t", "fuzzy", "login");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Query failed");
    }

    @Test
    @DisplayName("Should report change impact for an indexed entity")
    void impact_knownEntity_printsReport() {
        run("index", "-d", workspace.toString());

        int exitCode = run("impact", "-d", workspace.toString(), "FR-001", "--change-type", "removal");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Impact of removal on FR-001").contains("UOW-101");
    }

    @Test
    @DisplayName("Should fail impact analysis for unknown entities")
    void impact_unknownEntity_fails() {
        run("index", "-d", workspace.toString());

        int exitCode = run("impact", "-d", workspace.toString(), "FR-999");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Impact analysis failed").contains("FR-999");
    }

    @Test
    @DisplayName("Should require an entity ID unless listing critical dependencies")
    void impact_withoutIds_requiresCritical() {
        run("index", "-d", workspace.toString());

        assertThat(run("impact", "-d", workspace.toString())).isEqualTo(1);
        assertThat(run("impact", "-d", workspace.toString(), "--critical")).isZero();
        assertThat(stdout()).contains("Critical dependencies");
    }

    @Test
    @DisplayName("Should report sync state")
    void sync_detectAfterIndex_isInSync() {
        run("index", "-d", workspace.toString());

        int exitCode = run("sync", "-d", workspace.toString(), "--detect");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Index is in sync");
    }

    @Test
    @DisplayName("Should build the index through a full sync")
    void sync_full_indexesWorkspace() {
        int exitCode = run("sync", "-d", workspace.toString(), "--full");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Synchronized 4 entities");
        assertThat(workspace.resolve("docs/ssot/.index/entities.json")).exists();
    }

    @Test
    @DisplayName("Should exit with 2 when gaps exist and --fail-on-gaps is set")
    void gaps_failOnGaps_returnsTwo() {
        run("index", "-d", workspace.toString());

        assertThat(run("gaps", "-d", workspace.toString())).isZero();
        assertThat(stdout()).contains("FR-002");
        assertThat(run("gaps", "-d", workspace.toString(), "--fail-on-gaps")).isEqualTo(2);
    }

    private int run(String... args) {
        return ReqGraphCLI.commandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = workspace.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
