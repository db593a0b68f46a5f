package com.reqgraph.core.sync;

import com.reqgraph.core.indexer.ReferenceField;
import com.reqgraph.core.model.ConflictResolution;
import com.reqgraph.core.model.ConflictType;
import com.reqgraph.core.model.Entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the divergence between the authoritative and derived value of an entity,
 * and maps each classification to a fixed resolution.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>index written by another schema version: {@link ConflictType#SCHEMA_MISMATCH}</li>
 *   <li>value missing on one side: {@link ConflictType#CONTENT_DIVERGENCE}</li>
 *   <li>same content hash, different type or source: {@link ConflictType#METADATA_MISMATCH}</li>
 *   <li>content differs only in reference fields: {@link ConflictType#DEPENDENCY_CONFLICT}</li>
 *   <li>content differs otherwise: {@link ConflictType#CONTENT_DIVERGENCE}</li>
 * </ol>
 */
public class ConflictClassifier {

    /** Resolution chosen for each conflict type. */
    public static final Map<ConflictType, ConflictResolution> RESOLUTIONS;

    static {
        Map<ConflictType, ConflictResolution> resolutions = new EnumMap<>(ConflictType.class);
        resolutions.put(ConflictType.METADATA_MISMATCH, ConflictResolution.PREFER_AUTHORITATIVE);
        resolutions.put(ConflictType.CONTENT_DIVERGENCE, ConflictResolution.MANUAL_REVIEW_REQUIRED);
        resolutions.put(ConflictType.DEPENDENCY_CONFLICT, ConflictResolution.MERGE_DEPENDENCIES);
        resolutions.put(ConflictType.SCHEMA_MISMATCH, ConflictResolution.UPGRADE_TO_LATEST_SCHEMA);
        RESOLUTIONS = Collections.unmodifiableMap(resolutions);
    }

    private final String currentSchemaVersion;

    public ConflictClassifier(String currentSchemaVersion) {
        this.currentSchemaVersion = Objects.requireNonNull(currentSchemaVersion, "currentSchemaVersion must not be null");
    }

    /**
     * Classifies a pair of values.
     *
     * @param authoritative value derived from the documents, or null
     * @param derived value held by the index, or null
     * @param storedSchemaVersion schema version of the index, or null if unknown
     * @return conflict type, empty when both sides agree
     */
    public Optional<ConflictType> classify(Entity authoritative, Entity derived, String storedSchemaVersion) {
        if (storedSchemaVersion != null && !storedSchemaVersion.isEmpty()
            && !currentSchemaVersion.equals(storedSchemaVersion)) {
            return Optional.of(ConflictType.SCHEMA_MISMATCH);
        }
        if (authoritative == null && derived == null) {
            return Optional.empty();
        }
        if (authoritative == null || derived == null) {
            return Optional.of(ConflictType.CONTENT_DIVERGENCE);
        }
        if (authoritative.contentHash().equals(derived.contentHash())) {
            boolean metadataDiffers = authoritative.type() != derived.type()
                || !authoritative.source().equals(derived.source());
            return metadataDiffers ? Optional.of(ConflictType.METADATA_MISMATCH) : Optional.empty();
        }
        if (ReferenceField.withoutReferences(authoritative.attributes())
            .equals(ReferenceField.withoutReferences(derived.attributes()))) {
            return Optional.of(ConflictType.DEPENDENCY_CONFLICT);
        }
        return Optional.of(ConflictType.CONTENT_DIVERGENCE);
    }

    /**
     * Returns the resolution for a conflict type.
     *
     * @param type conflict type
     * @return resolution
     */
    public ConflictResolution resolve(ConflictType type) {
        return RESOLUTIONS.get(type);
    }
}
