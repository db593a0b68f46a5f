package com.reqgraph.core.exception;

import java.util.Map;

/**
 * Thrown when caller-supplied input (query text, entity id, change type) is empty or malformed.
 */
public class InvalidInputException extends ReqGraphException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Map<String, ?> context) {
        super(ErrorCode.INVALID_INPUT, message, context);
    }
}
