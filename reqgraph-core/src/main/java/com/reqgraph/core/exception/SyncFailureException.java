package com.reqgraph.core.exception;

import java.util.Map;

/**
 * Thrown when a synchronization phase cannot complete.
 */
public class SyncFailureException extends ReqGraphException {

    private final String phase;

    public SyncFailureException(String phase, String message, Throwable cause) {
        super(ErrorCode.SYNC_FAILURE, message, Map.of("phase", phase, "operation", "sync"), cause);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
