package com.reqgraph.core.store;

/**
 * Lifecycle of a file-backed store handle.
 *
 * <p>Handles are created explicitly and passed to the components that use them.
 * {@link #close()} flushes pending writes.
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Prepares the store for use, creating its directory if needed.
     */
    void open();

    /**
     * Persists any staged writes.
     */
    void flush();

    @Override
    void close();
}
