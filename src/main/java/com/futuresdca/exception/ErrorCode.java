package com.futuresdca.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned in {@code error.code}. The code is the constant name; the
 * HTTP status is fixed per code.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),

    /** Simulation config or sweep parameters out of range. */
    INVALID_CONFIG(HttpStatus.BAD_REQUEST),

    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Price series too short to simulate. */
    INSUFFICIENT_DATA(HttpStatus.UNPROCESSABLE_ENTITY),

    /** Every candidate of a sweep failed or was skipped. */
    NO_VALID_CANDIDATES(HttpStatus.UNPROCESSABLE_ENTITY),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),

    /** Price source unreadable or malformed. */
    MARKET_DATA_ERROR(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public String getCode() {
        return name();
    }

    public int getHttpStatus() {
        return status.value();
    }

    public boolean isServerError() {
        return status.is5xxServerError();
    }
}
