package com.reqgraph.cli;

import com.reqgraph.core.impact.ImpactAnalyzer;
import com.reqgraph.core.model.ChangeType;
import com.reqgraph.core.model.CriticalDependency;
import com.reqgraph.core.model.ImpactItem;
import com.reqgraph.core.model.ImpactMatrix;
import com.reqgraph.core.model.ImpactReport;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RemovalSimulation;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to analyze change impact over the index.
 *
 * <p>Modes, in order of precedence:
 * <ul>
 *   <li>{@code --critical}: list entities above the criticality threshold</li>
 *   <li>{@code --matrix}: pairwise impact levels between the given entities</li>
 *   <li>{@code --simulate-removal}: broken links and orphans if the entity is removed</li>
 *   <li>default: change impact report for one entity</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * reqgraph impact FR-001
 * reqgraph impact FR-001 --change-type removal
 * reqgraph impact FR-001 UOW-101 CON-001 --matrix
 * reqgraph impact --critical --json
 * }</pre>
 */
@Command(
    name = "impact",
    description = "Analyze change impact, critical dependencies and entity removal",
    mixinStandardHelpOptions = true
)
public class ImpactCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImpactCommand.class);

    @Mixin
    private WorkspaceOptions options;

    @Parameters(arity = "0..*", description = "Entity IDs")
    private List<String> entityIds = List.of();

    @Option(
        names = {"--change-type"},
        description = "Change type: modification, major_modification, removal (default: modification)",
        defaultValue = "modification"
    )
    private String changeType;

    @Option(names = {"--matrix"}, description = "Print the impact matrix of the given entities")
    private boolean matrix;

    @Option(names = {"--critical"}, description = "List critical dependencies")
    private boolean critical;

    @Option(names = {"--simulate-removal"}, description = "Simulate removing the given entity")
    private boolean simulateRemoval;

    @Option(names = {"--json"}, description = "Print the result as JSON")
    private boolean json;

    @Override
    public Integer call() {
        try (Workspace workspace = options.open()) {
            ImpactAnalyzer analyzer = workspace.impactAnalyzer();

            if (critical) {
                List<CriticalDependency> dependencies = analyzer.findCriticalDependencies();
                if (json) {
                    printJson(dependencies);
                } else {
                    printCritical(dependencies);
                }
                return 0;
            }

            if (entityIds == null || entityIds.isEmpty()) {
                System.err.println("✗ Impact analysis failed: at least one entity ID is required");
                return 1;
            }

            if (matrix) {
                ImpactMatrix result = analyzer.generateImpactMatrix(entityIds);
                if (json) {
                    printJson(result);
                } else {
                    printMatrix(result);
                }
            } else if (simulateRemoval) {
                RemovalSimulation result = analyzer.simulateEntityRemoval(entityIds.get(0));
                if (json) {
                    printJson(result);
                } else {
                    printRemoval(result);
                }
            } else {
                ImpactReport report = analyzer.analyzeChangeImpact(entityIds.get(0), ChangeType.parse(changeType));
                if (json) {
                    printJson(report);
                } else {
                    printReport(report);
                }
            }
            return 0;
        } catch (Exception e) {
            log.error("Impact analysis failed", e);
            System.err.println("✗ Impact analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printJson(Object value) throws Exception {
        System.out.println(JsonMappers.json().writeValueAsString(value));
    }

    private void printReport(ImpactReport report) {
        System.out.println("Impact of " + report.changeType().label() + " on " + report.sourceEntity());
        System.out.println();
        printItems("Direct impacts", report.directImpacts());
        printItems("Indirect impacts", report.indirectImpacts());
        printItems("Cascade impacts", report.cascadeImpacts());

        System.out.println("Risk: " + report.riskAssessment().overallRisk().label()
            + " (score " + report.riskAssessment().riskScore() + ")");
        report.riskAssessment().riskFactors().forEach(factor -> System.out.println("  - " + factor));
        if (!report.affectedLayers().isEmpty()) {
            System.out.println("Affected layers: " + String.join(", ", report.affectedLayers()));
        }
        if (!report.mitigationStrategies().isEmpty()) {
            System.out.println();
            System.out.println("Mitigation:");
            report.mitigationStrategies().forEach(strategy -> System.out.println("  - " + strategy));
        }
        System.out.println();
        System.out.println("Testing:");
        report.testingRecommendations().forEach(recommendation -> System.out.println("  - " + recommendation));
    }

    private void printItems(String heading, List<ImpactItem> items) {
        System.out.println(heading + " (" + items.size() + "):");
        for (ImpactItem item : items) {
            System.out.println("  • " + item.entityId() + " [" + item.severity().label() + "] " + item.description());
        }
        System.out.println();
    }

    private void printMatrix(ImpactMatrix result) {
        for (String source : result.entityIds()) {
            StringBuilder row = new StringBuilder(source).append(':');
            for (String target : result.entityIds()) {
                if (target.equals(source)) {
                    continue;
                }
                row.append(' ').append(target).append('=').append(result.level(source, target).label());
            }
            System.out.println(row);
        }
    }

    private void printCritical(List<CriticalDependency> dependencies) {
        System.out.println("Critical dependencies (" + dependencies.size() + "):");
        for (CriticalDependency dependency : dependencies) {
            System.out.println(String.format(Locale.ROOT, "  • %s (%s) criticality %.2f",
                dependency.entityId(), dependency.entityType().code(), dependency.criticalityScore()));
            dependency.riskFactors().forEach(factor -> System.out.println("      " + factor));
        }
    }

    private void printRemoval(RemovalSimulation result) {
        System.out.println("Removal of " + result.removedEntity());
        System.out.println();
        System.out.println("Broken relationships (" + result.brokenRelationships().size() + "):");
        for (Relationship relationship : result.brokenRelationships()) {
            System.out.println("  • " + relationship.source() + " -[" + relationship.type() + "]-> " + relationship.target());
        }
        System.out.println("Orphaned entities: " + result.orphanedEntities());
        System.out.println("Cascade removals: " + result.cascadeRemovals());
        System.out.println("Affected contracts: " + result.affectedContracts());
        System.out.println();
        System.out.println("Recovery plan:");
        for (int i = 0; i < result.recoveryPlan().size(); i++) {
            System.out.println("  " + (i + 1) + ". " + result.recoveryPlan().get(i));
        }
    }
}
