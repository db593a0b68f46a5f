package com.reqgraph.cli;

import com.reqgraph.core.document.DocumentSet;
import com.reqgraph.core.model.DanglingReference;
import com.reqgraph.core.model.IndexResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Command to rebuild the derived index from the authoritative documents.
 *
 * <p>Loads framework requirements, contracts, extensions and promoted knowledge, converts
 * them into entities and relationships, and replaces the index atomically. Malformed records
 * are skipped and listed as warnings.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * reqgraph index
 * reqgraph index -d /path/to/workspace
 * }</pre>
 */
@Command(
    name = "index",
    description = "Build the derived index from the authoritative documents",
    mixinStandardHelpOptions = true
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Mixin
    private WorkspaceOptions options;

    @Override
    public Integer call() {
        try (Workspace workspace = options.open()) {
            System.out.println("Indexing documents: " + workspace.documentStore().root());
            System.out.println();

            DocumentSet documents = workspace.documentStore().load();
            IndexResult result = workspace.indexer().indexAndPersist(documents, Instant.now());

            System.out.println("✓ Indexed " + result.entities().size() + " entities, "
                + result.relationships().size() + " relationships");
            System.out.println("  Index: " + workspace.indexStore().directory());

            if (!result.danglingReferences().isEmpty()) {
                System.out.println();
                System.out.println("Dangling references (" + result.danglingReferences().size() + "):");
                for (DanglingReference reference : result.danglingReferences()) {
                    System.out.println("  ⚠ " + reference.source() + " -[" + reference.type() + "]-> " + reference.target());
                }
            }
            if (!result.warnings().isEmpty()) {
                System.out.println();
                System.out.println("Warnings (" + result.warnings().size() + "):");
                result.warnings().forEach(warning -> System.out.println("  ⚠ " + warning));
            }
            return 0;
        } catch (Exception e) {
            log.error("Indexing failed", e);
            System.err.println("✗ Indexing failed: " + e.getMessage());
            return 1;
        }
    }
}
