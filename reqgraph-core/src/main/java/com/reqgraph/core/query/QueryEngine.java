package com.reqgraph.core.query;

import com.reqgraph.core.exception.InvalidQueryException;
import com.reqgraph.core.graph.RequirementGraph;
import com.reqgraph.core.impact.ImpactAnalyzer;
import com.reqgraph.core.model.ChangeType;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.KnowledgeKind;
import com.reqgraph.core.model.KnowledgeRecord;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Answers keyword, relationship, pattern, impact, coverage and gap queries against a graph.
 *
 * <p>Queries are read-only and deterministic: unchanged graph state and input give identical
 * results in identical order. An entity ID that does not resolve yields no results rather
 * than an error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * QueryEngine engine = new QueryEngine(graph, knowledge, new FeatureFileCatalog(featuresDir));
 * QueryResult result = engine.query("gaps", QueryType.AUTO);
 * }</pre>
 */
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private static final Comparator<KeywordHit> BY_RELEVANCE =
        Comparator.comparingDouble(KeywordHit::relevance).reversed()
            .thenComparing(hit -> hit.entity().id());

    private final RequirementGraph graph;
    private final List<KnowledgeRecord> knowledge;
    private final CoverageAnalyzer coverageAnalyzer;
    private final ImpactAnalyzer impactAnalyzer;
    private final PatternCategories patternCategories;

    public QueryEngine(RequirementGraph graph, List<KnowledgeRecord> knowledge, BddArtifactCatalog bddCatalog) {
        this(graph, knowledge, bddCatalog, new ImpactAnalyzer(graph), PatternCategories.defaults());
    }

    public QueryEngine(RequirementGraph graph, List<KnowledgeRecord> knowledge, BddArtifactCatalog bddCatalog,
                       ImpactAnalyzer impactAnalyzer, PatternCategories patternCategories) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.knowledge = List.copyOf(Objects.requireNonNull(knowledge, "knowledge must not be null"));
        this.coverageAnalyzer = new CoverageAnalyzer(graph, Objects.requireNonNull(bddCatalog, "bddCatalog must not be null"));
        this.impactAnalyzer = Objects.requireNonNull(impactAnalyzer, "impactAnalyzer must not be null");
        this.patternCategories = Objects.requireNonNull(patternCategories, "patternCategories must not be null");
    }

    /**
     * Executes a query.
     *
     * @param text query text
     * @param type query type, {@link QueryType#AUTO} (or null) to detect it from the text
     * @return query result
     * @throws InvalidQueryException if the text is empty or blank
     */
    public QueryResult query(String text, QueryType type) {
        if (text == null || text.isBlank()) {
            throw new InvalidQueryException("Query text must not be empty", text);
        }
        QueryType effective = type == null || type == QueryType.AUTO ? QueryIntentDetector.detect(text) : type;

        List<QueryHit> results = switch (effective) {
            case KEYWORD, AUTO -> new ArrayList<>(keywordSearch(text));
            case RELATIONSHIP -> new ArrayList<>(relationshipSearch(text));
            case PATTERN -> new ArrayList<>(searchPatterns(patternCategories.categoryFor(text).orElse(null)));
            case IMPACT -> impactSearch(text);
            case COVERAGE, GAP -> List.of(new CoverageHit(coverageAnalyzer.analyze()));
        };

        log.debug("Query '{}' executed as {} with {} results", text, effective.label(), results.size());
        return new QueryResult(text, results, new QueryMetadata(effective, results.size()));
    }

    /**
     * Ranks requirements by keyword relevance.
     *
     * <p>Each whitespace-separated token is matched case-insensitively against title,
     * description and acceptance criteria. Hits are merged by entity, keeping the highest
     * relevance, and sorted by relevance descending then ID ascending.
     *
     * @param text query text
     * @return keyword hits
     */
    public List<KeywordHit> keywordSearch(String text) {
        Map<String, KeywordHit> best = new LinkedHashMap<>();
        for (String token : text.trim().split("\\s+")) {
            String keyword = token.toLowerCase(Locale.ROOT);
            for (Entity entity : graph.entities()) {
                if (!entity.type().requirementKind()) {
                    continue;
                }
                String searchable = searchableText(entity);
                int occurrences = countOccurrences(searchable, keyword);
                if (occurrences == 0) {
                    continue;
                }
                double relevance = (double) occurrences / Math.max(wordCount(searchable), 1);
                KeywordHit hit = new KeywordHit(entity, relevance, fieldMatches(entity, keyword));
                best.merge(entity.id(), hit, (kept, candidate) -> candidate.relevance() > kept.relevance() ? candidate : kept);
            }
        }
        List<KeywordHit> hits = new ArrayList<>(best.values());
        hits.sort(BY_RELEVANCE);
        return hits;
    }

    /**
     * Returns entities one {@code IMPLEMENTS} or {@code VALIDATES} edge away from each
     * entity ID named in the text.
     *
     * @param text query text
     * @return relationship hits, de-duplicated per queried entity
     */
    public List<RelationshipHit> relationshipSearch(String text) {
        List<RelationshipHit> hits = new ArrayList<>();
        for (String id : resolveIds(text)) {
            Set<String> seen = new LinkedHashSet<>();
            for (Relationship rel : graph.incident(id)) {
                if (rel.type() != RelationshipType.IMPLEMENTS && rel.type() != RelationshipType.VALIDATES) {
                    continue;
                }
                String otherId = rel.otherEnd(id);
                if (otherId.equals(id) || !seen.add(otherId)) {
                    continue;
                }
                graph.entity(otherId).ifPresent(other -> hits.add(new RelationshipHit(other, id, rel.type(), true)));
            }
        }
        return hits;
    }

    /**
     * Finds units of work implementing a requirement, followed by units of work that depend
     * on an implementing one ({@code direct = false}).
     *
     * @param requirementId requirement ID
     * @return implementing units of work
     */
    public List<RelationshipHit> findImplementingUnits(String requirementId) {
        List<RelationshipHit> hits = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        List<String> implementers = new ArrayList<>();
        for (Relationship rel : graph.incoming(requirementId, RelationshipType.IMPLEMENTS)) {
            Optional<Entity> unit = graph.entity(rel.source());
            if (unit.isPresent() && seen.add(rel.source())) {
                implementers.add(rel.source());
                hits.add(new RelationshipHit(unit.get(), requirementId, RelationshipType.IMPLEMENTS, true));
            }
        }
        for (String implementer : implementers) {
            for (Relationship rel : graph.incoming(implementer, RelationshipType.DEPENDS_ON)) {
                graph.entity(rel.source())
                    .filter(entity -> entity.type() == EntityType.UNIT_OF_WORK)
                    .filter(entity -> seen.add(entity.id()))
                    .ifPresent(entity -> hits.add(new RelationshipHit(entity, requirementId, null, false)));
            }
        }
        return hits;
    }

    /**
     * Finds contracts validating an entity.
     *
     * @param entityId validated entity ID
     * @return contract hits
     */
    public List<RelationshipHit> findRelatedContracts(String entityId) {
        List<RelationshipHit> hits = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Relationship rel : graph.incoming(entityId, RelationshipType.VALIDATES)) {
            graph.entity(rel.source())
                .filter(entity -> entity.type() == EntityType.CONTRACT)
                .filter(entity -> seen.add(entity.id()))
                .ifPresent(entity -> hits.add(new RelationshipHit(entity, entityId, RelationshipType.VALIDATES, true)));
        }
        return hits;
    }

    /**
     * Returns learned patterns, most frequent first, ties by ID.
     *
     * @param category category to filter by, or null for all patterns
     * @return pattern hits
     */
    public List<PatternHit> searchPatterns(String category) {
        return knowledge.stream()
            .filter(record -> record.kind() == KnowledgeKind.PATTERN)
            .filter(record -> category == null || category.equals(record.category()))
            .sorted(Comparator.comparingInt(KnowledgeRecord::frequency).reversed()
                .thenComparing(KnowledgeRecord::id))
            .map(PatternHit::new)
            .toList();
    }

    private List<QueryHit> impactSearch(String text) {
        List<QueryHit> hits = new ArrayList<>();
        for (String id : resolveIds(text)) {
            hits.add(new ImpactHit(id, impactAnalyzer.analyzeChangeImpact(id, ChangeType.MODIFICATION)));
        }
        return hits;
    }

    private List<String> resolveIds(String text) {
        Set<String> ids = new LinkedHashSet<>();
        for (String candidate : EntityIdExtractor.extract(text)) {
            Optional<String> resolved = graph.resolveId(candidate);
            if (resolved.isPresent()) {
                ids.add(resolved.get());
            } else {
                log.debug("Query names unknown entity {}", candidate);
            }
        }
        return List.copyOf(ids);
    }

    private static String searchableText(Entity entity) {
        return String.join(" ",
            entity.text("title"),
            entity.text("description"),
            String.join(" ", entity.texts("acceptance_criteria"))
        ).toLowerCase(Locale.ROOT);
    }

    private static List<String> fieldMatches(Entity entity, String keyword) {
        List<String> matches = new ArrayList<>();
        String title = entity.text("title");
        if (title.toLowerCase(Locale.ROOT).contains(keyword)) {
            matches.add("title: " + title);
        }
        String description = entity.text("description");
        if (description.toLowerCase(Locale.ROOT).contains(keyword)) {
            matches.add("description: " + description);
        }
        return matches;
    }

    static int countOccurrences(String text, String keyword) {
        if (keyword.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = text.indexOf(keyword);
        while (index >= 0) {
            count++;
            index = text.indexOf(keyword, index + keyword.length());
        }
        return count;
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
