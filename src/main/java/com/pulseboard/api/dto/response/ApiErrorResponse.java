package com.pulseboard.api.dto.response;

import com.pulseboard.exception.ErrorCode;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Failure envelope written by {@link com.pulseboard.exception.GlobalExceptionHandler}.
 * Field-level validation messages go in {@code error.details}, keyed by request field.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.success = false;
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> safeDetails =
                details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        return new ApiErrorResponse(new ErrorDetail(
                errorCode.getCode(), errorCode.getHttpStatus(), message, safeDetails, path, Instant.now()));
    }

    /** Error code, HTTP status and request path of a failed call. */
    public record ErrorDetail(
            String code, int status, String message, Map<String, Object> details, String path, Instant timestamp) {}
}
