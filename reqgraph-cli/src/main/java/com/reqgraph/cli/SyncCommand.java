package com.reqgraph.cli;

import com.reqgraph.core.model.SyncConflict;
import com.reqgraph.core.sync.ChangeSet;
import com.reqgraph.core.sync.SyncEngine;
import com.reqgraph.core.sync.SyncResult;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to reconcile the authoritative documents with the derived stores.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * reqgraph sync --detect
 * reqgraph sync --full
 * reqgraph sync --incremental
 * }</pre>
 */
@Command(
    name = "sync",
    description = "Detect and reconcile drift between documents, index and learned knowledge",
    mixinStandardHelpOptions = true
)
public class SyncCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    @Mixin
    private WorkspaceOptions options;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private Mode mode = new Mode();

    @Option(names = {"--json"}, description = "Print the result as JSON")
    private boolean json;

    static class Mode {
        @Option(names = {"--detect"}, description = "Only report pending changes")
        boolean detect;

        @Option(names = {"--full"}, description = "Synchronize both directions (default)")
        boolean full;

        @Option(names = {"--incremental"}, description = "Synchronize only when changes are pending")
        boolean incremental;
    }

    @Override
    public Integer call() {
        try (Workspace workspace = options.open()) {
            SyncEngine engine = workspace.syncEngine();

            if (mode != null && mode.detect) {
                ChangeSet changes = engine.detectChanges();
                if (json) {
                    System.out.println(JsonMappers.json().writeValueAsString(changes));
                } else {
                    printChanges(changes);
                }
                return 0;
            }

            SyncResult result = mode != null && mode.incremental ? engine.incrementalSync() : engine.fullSync();
            if (json) {
                System.out.println(JsonMappers.json().writeValueAsString(result));
            } else if (result.success()) {
                System.out.println("✓ Synchronized " + result.entitiesUpdated() + " entities");
                printConflicts(result.conflicts());
            } else {
                System.err.println("✗ Sync failed: " + result.error());
            }
            return result.success() ? 0 : 1;
        } catch (Exception e) {
            log.error("Sync failed", e);
            System.err.println("✗ Sync failed: " + e.getMessage());
            return 1;
        }
    }

    private void printChanges(ChangeSet changes) {
        if (!changes.hasChanges()) {
            System.out.println("✓ Index is in sync");
            return;
        }
        System.out.println("Authoritative updates (" + changes.authoritativeUpdates().size() + "):");
        changes.authoritativeUpdates().forEach(id -> System.out.println("  • " + id));
        System.out.println("Derived updates (" + changes.derivedUpdates().size() + "):");
        changes.derivedUpdates().forEach(id -> System.out.println("  • " + id));
        printConflicts(changes.conflicts());
    }

    private void printConflicts(List<SyncConflict> conflicts) {
        if (conflicts.isEmpty()) {
            return;
        }
        System.out.println("Conflicts (" + conflicts.size() + "):");
        for (SyncConflict conflict : conflicts) {
            String marker = conflict.unresolved() ? "⚠" : "•";
            System.out.println("  " + marker + " " + conflict.entityId() + " " + conflict.conflictType()
                + " -> " + conflict.resolution());
        }
    }
}
