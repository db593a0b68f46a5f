package com.reqgraph.cli;

import com.reqgraph.core.config.ConfigLoader;
import com.reqgraph.core.config.ReqGraphConfig;
import com.reqgraph.core.document.DocumentStore;
import com.reqgraph.core.graph.RequirementGraph;
import com.reqgraph.core.impact.ImpactAnalyzer;
import com.reqgraph.core.indexer.Indexer;
import com.reqgraph.core.query.CoverageAnalyzer;
import com.reqgraph.core.query.FeatureFileCatalog;
import com.reqgraph.core.query.PatternCategories;
import com.reqgraph.core.query.QueryEngine;
import com.reqgraph.core.store.IndexStore;
import com.reqgraph.core.store.KnowledgeStore;
import com.reqgraph.core.sync.SyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Stores and engines of one workspace, wired from {@code reqgraph.yaml}.
 *
 * <p>Relative directories in the configuration resolve against the workspace root.
 * Closing the workspace flushes and closes both derived stores.
 */
final class Workspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final ReqGraphConfig config;
    private final DocumentStore documentStore;
    private final IndexStore indexStore;
    private final KnowledgeStore knowledgeStore;
    private final Path featuresDir;

    private Workspace(ReqGraphConfig config, Path documentsDir, Path indexDir, Path knowledgeDir, Path featuresDir) {
        this.config = config;
        this.documentStore = new DocumentStore(documentsDir);
        this.indexStore = new IndexStore(indexDir);
        this.knowledgeStore = new KnowledgeStore(knowledgeDir);
        this.featuresDir = featuresDir;
    }

    /**
     * Loads configuration and opens the derived stores.
     *
     * @param root workspace root
     * @param configPath configuration file, or null for {@code <root>/reqgraph.yaml}
     * @param documentsOverride document directory override, or null
     * @param indexOverride index directory override, or null
     * @return opened workspace
     */
    static Workspace open(Path root, Path configPath, Path documentsOverride, Path indexOverride) {
        Path base = root.toAbsolutePath().normalize();
        ReqGraphConfig config = ConfigLoader.loadForWorkspace(base, configPath);

        Path documentsDir = documentsOverride != null
            ? documentsOverride.toAbsolutePath()
            : base.resolve(config.documents().directory());
        Path indexDir = indexOverride != null
            ? indexOverride.toAbsolutePath()
            : base.resolve(config.index().directory());

        Workspace workspace = new Workspace(config, documentsDir.normalize(), indexDir.normalize(),
            base.resolve(config.knowledge().directory()).normalize(),
            base.resolve(config.features().directory()).normalize());
        workspace.indexStore.open();
        workspace.knowledgeStore.open();
        log.debug("Opened workspace {} (documents: {}, index: {})", base, documentsDir, indexDir);
        return workspace;
    }

    DocumentStore documentStore() {
        return documentStore;
    }

    IndexStore indexStore() {
        return indexStore;
    }

    Indexer indexer() {
        return new Indexer(indexStore);
    }

    RequirementGraph graph() {
        return indexStore.loadGraph();
    }

    ImpactAnalyzer impactAnalyzer() {
        return new ImpactAnalyzer(graph());
    }

    QueryEngine queryEngine() {
        RequirementGraph graph = graph();
        return new QueryEngine(graph, knowledgeStore.loadAll(), new FeatureFileCatalog(featuresDir),
            new ImpactAnalyzer(graph), PatternCategories.of(config.query().patternCategories()));
    }

    CoverageAnalyzer coverageAnalyzer() {
        return new CoverageAnalyzer(graph(), new FeatureFileCatalog(featuresDir));
    }

    SyncEngine syncEngine() {
        return new SyncEngine(documentStore, indexStore, knowledgeStore, indexer(), Clock.systemUTC());
    }

    @Override
    public void close() {
        indexStore.close();
        knowledgeStore.close();
    }
}
