package com.futuresdca.exception;

import java.util.Map;

public class NoValidCandidatesException extends BaseException {

    public NoValidCandidatesException(int attempted, Throwable lastFailure) {
        super(
                ErrorCode.NO_VALID_CANDIDATES,
                String.format("All %d sweep candidates failed", attempted),
                Map.of(
                        "attempted",
                        attempted,
                        "lastError",
                        lastFailure != null && lastFailure.getMessage() != null ? lastFailure.getMessage() : "none"),
                lastFailure);
    }
}
