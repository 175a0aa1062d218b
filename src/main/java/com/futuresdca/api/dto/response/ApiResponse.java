package com.futuresdca.api.dto.response;

import java.time.Instant;
import lombok.Value;

/** Success envelope applied to every controller body by {@link com.futuresdca.config.ApiResponseAdvice}. */
@Value
public class ApiResponse<T> {

    boolean success = true;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
