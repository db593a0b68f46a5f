package com.reqgraph.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for ReqGraph with a stable {@link ErrorCode} and diagnostic context.
 *
 * <p>The context map carries the entity id, operation and phase involved so that a failure
 * can be diagnosed from the message alone. It is copied on construction and unmodifiable.
 */
public class ReqGraphException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public ReqGraphException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public ReqGraphException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public ReqGraphException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public ReqGraphException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.context = copy(context);
    }

    public ErrorCode getCode() {
        return code;
    }

    /** Additional key/value details that help diagnosing the error. */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
            + "{code=" + code
            + ", message=" + getMessage()
            + (context.isEmpty() ? "" : ", context=" + context)
            + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
            + '}';
    }
}
