package com.reqgraph.core.exception;

import java.util.Map;

/**
 * Thrown when query text is empty or blank.
 */
public class InvalidQueryException extends InvalidInputException {

    public InvalidQueryException(String message, String queryText) {
        super(message, Map.of("operation", "query", "query", String.valueOf(queryText)));
    }
}
