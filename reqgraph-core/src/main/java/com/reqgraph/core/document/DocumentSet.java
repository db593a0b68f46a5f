package com.reqgraph.core.document;

import java.util.List;

/**
 * Snapshot of the authoritative document store.
 *
 * @param records records in load order (sorted by file, then document order)
 * @param warnings files that could not be parsed
 */
public record DocumentSet(
    List<DocumentRecord> records,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentSet {
        records = records == null ? List.of() : List.copyOf(records);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static DocumentSet of(List<DocumentRecord> records) {
        return new DocumentSet(records, List.of());
    }

    /**
     * Returns records of one kind, in load order.
     *
     * @param kind artifact kind
     * @return matching records
     */
    public List<DocumentRecord> ofKind(ArtifactKind kind) {
        return records.stream()
            .filter(record -> record.kind() == kind)
            .toList();
    }
}
