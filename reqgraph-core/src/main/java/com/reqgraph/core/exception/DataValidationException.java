package com.reqgraph.core.exception;

import java.util.Map;

/**
 * Thrown when a value does not conform to the data model, for example an unknown severity label.
 */
public class DataValidationException extends ReqGraphException {

    public DataValidationException(String message, Map<String, ?> context) {
        super(ErrorCode.DATA_VALIDATION, message, context);
    }
}
