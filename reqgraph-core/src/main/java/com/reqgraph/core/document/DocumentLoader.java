package com.reqgraph.core.document;

/**
 * Reads the authoritative documents into parsed records.
 */
public interface DocumentLoader {

    /**
     * Loads all records.
     *
     * <p>Files that cannot be parsed are reported in {@link DocumentSet#warnings()}
     * rather than failing the load.
     *
     * @return loaded document set
     */
    DocumentSet load();
}
