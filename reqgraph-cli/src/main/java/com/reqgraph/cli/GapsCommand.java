package com.reqgraph.cli;

import com.reqgraph.core.model.CoverageReport;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to report coverage gaps.
 *
 * <p>Returns exit code 2 with {@code --fail-on-gaps} when any gap exists, for use in CI.
 */
@Command(
    name = "gaps",
    description = "Report requirements, units of work and contracts with coverage gaps",
    mixinStandardHelpOptions = true
)
public class GapsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GapsCommand.class);

    @Mixin
    private WorkspaceOptions options;

    @Option(names = {"--json"}, description = "Print the report as JSON")
    private boolean json;

    @Option(names = {"--fail-on-gaps"}, description = "Exit with code 2 when gaps exist")
    private boolean failOnGaps;

    @Override
    public Integer call() {
        try (Workspace workspace = options.open()) {
            CoverageReport coverage = workspace.coverageAnalyzer().analyze();
            if (json) {
                System.out.println(JsonMappers.json().writeValueAsString(coverage));
            } else {
                System.out.println("Coverage gaps: " + coverage.gapCount());
                printCoverage(coverage);
            }
            return failOnGaps && coverage.gapCount() > 0 ? 2 : 0;
        } catch (Exception e) {
            log.error("Gap analysis failed", e);
            System.err.println("✗ Gap analysis failed: " + e.getMessage());
            return 1;
        }
    }

    static void printCoverage(CoverageReport coverage) {
        printSection("Requirements without units of work", coverage.requirementsWithoutUows());
        printSection("Units of work without contracts", coverage.uowsWithoutContracts());
        printSection("Units of work without BDD scenarios", coverage.uowsWithoutBdd());
        printSection("Orphaned contracts", coverage.orphanedContracts());
    }

    private static void printSection(String heading, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        System.out.println("  " + heading + " (" + ids.size() + "):");
        ids.forEach(id -> System.out.println("    - " + id));
    }
}
