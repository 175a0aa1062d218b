package com.futuresdca.api.dto.response;

import com.futuresdca.exception.BaseException;
import com.futuresdca.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope: {@code {success: false, error: {code, status, message, details, timestamp, path}}}.
 * Written only by {@link com.futuresdca.exception.GlobalExceptionHandler}.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorBody error;

    public static ApiErrorResponse from(BaseException ex, String path) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path);
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null ? Map.of() : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Value
    @Builder
    public static class ErrorBody {
        String code;
        int status;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
