package com.reqgraph.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by every command that operates on a workspace.
 */
public class WorkspaceOptions {

    @Option(
        names = {"-d", "--workspace"},
        description = "Workspace root directory (default: current directory)",
        defaultValue = "."
    )
    Path workspace = Paths.get(".");

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <workspace>/reqgraph.yaml)"
    )
    Path configPath;

    @Option(
        names = {"--documents"},
        description = "Authoritative document directory (overrides config)"
    )
    Path documentsDir;

    @Option(
        names = {"--index"},
        description = "Derived index directory (overrides config)"
    )
    Path indexDir;

    /**
     * Opens the workspace described by these options.
     *
     * @return opened workspace
     */
    Workspace open() {
        return Workspace.open(workspace, configPath, documentsDir, indexDir);
    }
}
