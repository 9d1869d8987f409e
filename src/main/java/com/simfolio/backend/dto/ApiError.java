package com.simfolio.backend.dto;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed request. {@code errorCode} is the stable machine-readable kind;
 * the request and correlation ids are the ones logged for the same request.
 */
public record ApiError(
        Instant timestamp,
        String path,
        int status,
        String error,
        String errorCode,
        String message,
        String requestId,
        String correlationId,
        List<ApiErrorDetail> details
) {

    /** Request attribute carrying the error code of a failed request to the logging filter. */
    public static final String ERROR_CODE_ATTRIBUTE = ApiError.class.getName() + ".errorCode";

    public static ApiError of(HttpStatus status, String errorCode, String message, String path,
                              List<ApiErrorDetail> details) {
        return new ApiError(Instant.now(), path, status.value(), status.getReasonPhrase(), errorCode, message,
                MDC.get("requestId"), MDC.get("correlationId"), details == null ? List.of() : List.copyOf(details));
    }
}
