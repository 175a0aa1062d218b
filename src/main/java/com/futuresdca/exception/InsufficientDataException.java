package com.futuresdca.exception;

import java.util.Map;

/**
 * Thrown when a price series is too short to simulate. A simulation needs at least
 * two weekly points so that the first mark-to-market has a prior price.
 */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(int available, int required) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                String.format("Need at least %d price points, got %d", required, available),
                Map.of("available", available, "required", required));
    }
}
