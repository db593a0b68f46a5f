package com.reqgraph.core.exception;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Wraps an {@link IOException} raised while reading or writing one of the stores.
 */
public class StoreIoException extends ReqGraphException {

    public StoreIoException(String operation, Path path, IOException cause) {
        super(ErrorCode.IO_FAILURE,
            "Failed to " + operation + ": " + path + " (" + cause.getMessage() + ")",
            Map.of("operation", operation, "path", String.valueOf(path)),
            cause);
    }
}
