package com.reqgraph.cli;

import com.reqgraph.core.model.KnowledgeRecord;
import com.reqgraph.core.query.CoverageHit;
import com.reqgraph.core.query.KeywordHit;
import com.reqgraph.core.query.PatternHit;
import com.reqgraph.core.query.QueryHit;
import com.reqgraph.core.query.QueryResult;
import com.reqgraph.core.query.QueryType;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to query the index.
 *
 * <p>The query type is detected from the text unless {@code --type} is given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * reqgraph query "user authentication"
 * reqgraph query "what implements FR-001"
 * reqgraph query "show gaps" --json
 * reqgraph query "error patterns" --type pattern
 * }</pre>
 */
@Command(
    name = "query",
    description = "Query requirements, relationships, patterns, impact and coverage",
    mixinStandardHelpOptions = true
)
public class QueryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    @Mixin
    private WorkspaceOptions options;

    @Parameters(arity = "1..*", description = "Query text")
    private List<String> words;

    @Option(
        names = {"-t", "--type"},
        description = "Query type: auto, keyword, relationship, pattern, impact, coverage, gap (default: auto)",
        defaultValue = "auto"
    )
    private String type;

    @Option(names = {"--json"}, description = "Print the result as JSON")
    private boolean json;

    @Override
    public Integer call() {
        try (Workspace workspace = options.open()) {
            String text = String.join(" ", words);
            QueryResult result = workspace.queryEngine().query(text, QueryType.parse(type));

            if (json) {
                System.out.println(JsonMappers.json().writeValueAsString(result));
                return 0;
            }

            System.out.println("Query: " + result.query());
            System.out.println("Type: " + result.metadata().queryType().label()
                + " (" + result.metadata().resultsCount() + " results)");
            System.out.println();
            for (QueryHit hit : result.results()) {
                printHit(hit);
            }
            return 0;
        } catch (Exception e) {
            log.error("Query failed", e);
            System.err.println("✗ Query failed: " + e.getMessage());
            return 1;
        }
    }

    private void printHit(QueryHit hit) {
        System.out.println("  • " + hit.summary());
        if (hit instanceof KeywordHit keywordHit) {
            keywordHit.matches().forEach(match -> System.out.println("      " + match));
        } else if (hit instanceof PatternHit patternHit) {
            KnowledgeRecord pattern = patternHit.pattern();
            System.out.println("      category: " + pattern.category() + ", frequency: " + pattern.frequency());
        } else if (hit instanceof CoverageHit coverageHit) {
            GapsCommand.printCoverage(coverageHit.coverage());
        }
    }
}
