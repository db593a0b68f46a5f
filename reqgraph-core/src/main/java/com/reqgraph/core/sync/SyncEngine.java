package com.reqgraph.core.sync;

import com.reqgraph.core.document.DocumentStore;
import com.reqgraph.core.document.Promotion;
import com.reqgraph.core.exception.SyncFailureException;
import com.reqgraph.core.indexer.Indexer;
import com.reqgraph.core.model.ConflictType;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.IndexResult;
import com.reqgraph.core.model.KnowledgeKind;
import com.reqgraph.core.model.KnowledgeRecord;
import com.reqgraph.core.model.SyncConflict;
import com.reqgraph.core.store.IndexMetadata;
import com.reqgraph.core.store.IndexSnapshot;
import com.reqgraph.core.store.IndexStore;
import com.reqgraph.core.store.KnowledgeStore;
import com.reqgraph.core.util.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Keeps the authoritative document store and the derived index consistent.
 *
 * <p>This is the only component that reads both stores and writes to either. Sync phases are
 * all-or-nothing: when {@link #fullSync()} fails in either sync phase, both stores are
 * restored to their pre-sync content and conflict resolution is not attempted.
 */
public class SyncEngine {

    static final String PHASE_DETECT = "detect";
    static final String PHASE_AUTHORITATIVE = "authoritative_to_derived";
    static final String PHASE_DERIVED = "derived_to_authoritative";

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final DocumentStore documentStore;
    private final IndexStore indexStore;
    private final KnowledgeStore knowledgeStore;
    private final Indexer indexer;
    private final Clock clock;
    private final ConflictClassifier classifier;
    private final SyncLog syncLog;

    public SyncEngine(DocumentStore documentStore, IndexStore indexStore, KnowledgeStore knowledgeStore,
                      Indexer indexer, Clock clock) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore must not be null");
        this.indexStore = Objects.requireNonNull(indexStore, "indexStore must not be null");
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore must not be null");
        this.indexer = Objects.requireNonNull(indexer, "indexer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.classifier = new ConflictClassifier(IndexStore.SCHEMA_VERSION);
        this.syncLog = new SyncLog(indexStore.directory());
    }

    /**
     * Compares freshly indexed documents and the learning store against the stored index.
     *
     * <ul>
     *   <li>authoritative entity with a different hash, or missing from the index: authoritative update</li>
     *   <li>index-only entity of a derived-knowledge type: derived update</li>
     *   <li>knowledge record not promoted at its current content: derived update</li>
     *   <li>any other index-only entity: conflict</li>
     * </ul>
     *
     * @return detected changes
     */
    public ChangeSet detectChanges() {
        Map<String, Entity> authoritative = byId(indexer.index(documentStore.load()).entities());
        Map<String, Entity> derived = byId(indexStore.loadEntities());
        String storedSchema = indexStore.loadMetadata().map(IndexMetadata::schemaVersion).orElse(null);

        List<String> authoritativeUpdates = new ArrayList<>();
        authoritative.forEach((id, entity) -> {
            Entity stored = derived.get(id);
            if (stored == null || !stored.contentHash().equals(entity.contentHash())) {
                authoritativeUpdates.add(id);
            }
        });

        Set<String> derivedUpdates = new LinkedHashSet<>();
        List<SyncConflict> conflicts = new ArrayList<>();
        derived.forEach((id, stored) -> {
            if (authoritative.containsKey(id)) {
                return;
            }
            if (stored.type().derivedKnowledge()) {
                derivedUpdates.add(id);
            } else {
                ConflictType type = classifier.classify(null, stored, storedSchema)
                    .orElse(ConflictType.CONTENT_DIVERGENCE);
                conflicts.add(new SyncConflict(id, type, null, stored, null));
            }
        });

        Map<String, String> promoted = documentStore.promotedHashes();
        for (KnowledgeRecord record : knowledgeStore.loadAll()) {
            if (!ContentHasher.hash(record.attributes()).equals(promoted.get(record.id()))) {
                derivedUpdates.add(record.id());
            }
        }

        ChangeSet changes = new ChangeSet(authoritativeUpdates, List.copyOf(derivedUpdates), conflicts);
        log.info("Detected {} authoritative updates, {} derived updates, {} conflicts",
            changes.authoritativeUpdates().size(), changes.derivedUpdates().size(), changes.conflicts().size());
        return changes;
    }

    /**
     * Re-indexes the authoritative documents into the derived index.
     *
     * <p>The indexer has no partial mode, so the whole corpus is re-indexed whatever the IDs.
     *
     * @param ids entities known to have changed
     * @return number of changed entities
     * @throws SyncFailureException if re-indexing fails
     */
    public int syncAuthoritativeToDerived(Collection<String> ids) {
        return inPhase(PHASE_AUTHORITATIVE, () -> {
            IndexResult result = indexer.indexAndPersist(documentStore.load(), clock.instant());
            syncLog.event(clock.instant(), PHASE_AUTHORITATIVE,
                Map.of("requested", ids.size(), "entities_indexed", result.entities().size()));
            log.info("Synced {} authoritative changes into the index", ids.size());
            return ids.size();
        });
    }

    /**
     * Promotes derived knowledge into the authoritative store, then refreshes the index
     * so that both sides agree.
     *
     * <p>Candidates are knowledge records not yet promoted at their current content and
     * index-only entities of derived-knowledge types. Each promoted record keeps its
     * derived ID, kind and hash.
     *
     * @param ids derived IDs to promote
     * @return number of promoted records
     * @throws SyncFailureException if promotion or re-indexing fails
     */
    public int syncDerivedToAuthoritative(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return inPhase(PHASE_DERIVED, () -> {
            Set<String> wanted = new LinkedHashSet<>(ids);
            Map<String, String> promoted = documentStore.promotedHashes();
            Map<String, Promotion> promotions = new LinkedHashMap<>();

            for (KnowledgeRecord record : knowledgeStore.loadAll()) {
                String hash = ContentHasher.hash(record.attributes());
                if (wanted.contains(record.id()) && !hash.equals(promoted.get(record.id()))) {
                    promotions.put(record.id(), new Promotion(record.id(), record.kind(), record.attributes(), hash));
                }
            }
            Set<String> authoritativeIds = byId(indexer.index(documentStore.load()).entities()).keySet();
            for (Entity entity : indexStore.loadEntities()) {
                KnowledgeKind kind = KnowledgeKind.of(entity.type());
                if (kind != null && wanted.contains(entity.id()) && !authoritativeIds.contains(entity.id())) {
                    promotions.putIfAbsent(entity.id(),
                        new Promotion(entity.id(), kind, entity.attributes(), entity.contentHash()));
                }
            }

            int count = documentStore.promote(promotions.values(), clock.instant());
            if (count > 0) {
                indexer.indexAndPersist(documentStore.load(), clock.instant());
            }
            syncLog.event(clock.instant(), PHASE_DERIVED,
                Map.of("requested", wanted.size(), "promoted", count));
            return count;
        });
    }

    /**
     * Classifies and resolves conflicts for the given IDs against the current index.
     *
     * @param ids entity IDs to check
     * @return classified conflicts with their resolutions
     */
    public List<SyncConflict> resolveConflicts(Collection<String> ids) {
        return resolve(ids, currentDerivedState());
    }

    /**
     * Runs detect, authoritative sync, derived sync and conflict resolution in order.
     *
     * <p>If either sync phase fails, both stores are restored and the failure is reported.
     *
     * @return sync result
     */
    public SyncResult fullSync() {
        ChangeSet changes;
        DerivedState before;
        try {
            changes = detectChanges();
            before = currentDerivedState();
        } catch (RuntimeException e) {
            log.error("Change detection failed: {}", e.getMessage());
            return SyncResult.failed("Sync phase " + PHASE_DETECT + " failed: " + e.getMessage());
        }

        IndexSnapshot indexSnapshot = indexStore.snapshot();
        String promotedSnapshot = documentStore.snapshotPromoted();
        int updated = 0;
        try {
            if (!changes.authoritativeUpdates().isEmpty() || !changes.conflicts().isEmpty()) {
                updated += syncAuthoritativeToDerived(changes.authoritativeUpdates());
            }
            updated += syncDerivedToAuthoritative(changes.derivedUpdates());
        } catch (SyncFailureException e) {
            log.error("Sync phase {} failed, restoring both stores: {}", e.getPhase(), e.getMessage());
            indexStore.restore(indexSnapshot);
            documentStore.restorePromoted(promotedSnapshot);
            syncLog.event(clock.instant(), "sync_failed", Map.of("phase", e.getPhase(), "error", e.getMessage()));
            return SyncResult.failed(e.getMessage());
        }

        List<SyncConflict> resolved = resolve(changes.conflictIds(), before);
        syncLog.event(clock.instant(), "full_sync", Map.of("entities_updated", updated, "conflicts", resolved.size()));
        log.info("Full sync completed: {} entities updated, {} conflicts", updated, resolved.size());
        return SyncResult.ok(updated, resolved);
    }

    /**
     * Runs a full sync only when detection finds changes.
     *
     * @return sync result, with zero updates when nothing changed
     */
    public SyncResult incrementalSync() {
        ChangeSet changes;
        try {
            changes = detectChanges();
        } catch (RuntimeException e) {
            log.error("Change detection failed: {}", e.getMessage());
            return SyncResult.failed("Sync phase " + PHASE_DETECT + " failed: " + e.getMessage());
        }
        if (!changes.hasChanges()) {
            log.info("No changes detected");
            return SyncResult.ok(0, List.of());
        }
        return fullSync();
    }

    private List<SyncConflict> resolve(Collection<String> ids, DerivedState derivedState) {
        Map<String, Entity> authoritative = byId(indexer.index(documentStore.load()).entities());
        List<SyncConflict> resolved = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            Entity authoritativeValue = authoritative.get(id);
            Entity derivedValue = derivedState.entities().get(id);
            Optional<ConflictType> type = classifier.classify(authoritativeValue, derivedValue, derivedState.schemaVersion());
            if (type.isEmpty()) {
                continue;
            }
            SyncConflict conflict = new SyncConflict(id, type.get(), authoritativeValue, derivedValue, null)
                .withResolution(classifier.resolve(type.get()));
            syncLog.conflict(clock.instant(), conflict);
            if (conflict.unresolved()) {
                log.warn("Conflict on {} ({}) requires manual review", id, conflict.conflictType());
            } else {
                log.info("Conflict on {} ({}) resolved as {}", id, conflict.conflictType(), conflict.resolution());
            }
            resolved.add(conflict);
        }
        return resolved;
    }

    private DerivedState currentDerivedState() {
        return new DerivedState(
            byId(indexStore.loadEntities()),
            indexStore.loadMetadata().map(IndexMetadata::schemaVersion).orElse(null));
    }

    private static <T> T inPhase(String phase, Supplier<T> action) {
        try {
            return action.get();
        } catch (SyncFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SyncFailureException(phase, "Sync phase " + phase + " failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Entity> byId(List<Entity> entities) {
        Map<String, Entity> byId = new LinkedHashMap<>();
        entities.forEach(entity -> byId.putIfAbsent(entity.id(), entity));
        return byId;
    }

    private record DerivedState(Map<String, Entity> entities, String schemaVersion) {}
}
