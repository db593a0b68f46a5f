package com.reqgraph.core.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * Thrown when an index artifact exists but cannot be read back.
 *
 * <p>Every read operation fails with this exception until the index is rebuilt.
 */
public class IndexCorruptException extends ReqGraphException {

    public IndexCorruptException(Path artifact, Throwable cause) {
        super(ErrorCode.INDEX_CORRUPT,
            "Index artifact is unreadable: " + artifact + " (" + cause.getMessage() + ")",
            Map.of("artifact", artifact.toString(), "operation", "load-index"),
            cause);
    }

    public IndexCorruptException(Path artifact, String reason) {
        super(ErrorCode.INDEX_CORRUPT,
            "Index artifact is malformed: " + artifact + " (" + reason + ")",
            Map.of("artifact", artifact.toString(), "operation", "load-index"));
    }
}
