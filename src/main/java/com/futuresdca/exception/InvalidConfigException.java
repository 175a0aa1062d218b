package com.futuresdca.exception;

import java.util.Map;

/**
 * Thrown when a simulation config or sweep parameter violates its positivity or
 * ordering constraint. {@link #getDetails()} maps each offending field to the violated rule.
 */
public class InvalidConfigException extends BaseException {

    public InvalidConfigException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_CONFIG, message, details);
    }

    public InvalidConfigException(String field, String rule) {
        super(ErrorCode.INVALID_CONFIG, String.format("Invalid %s: %s", field, rule), Map.of(field, rule));
    }
}
