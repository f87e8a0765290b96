package com.costguard.anomaly.controller.dto;

import com.costguard.anomaly.web.RequestContextHolder;
import java.util.Map;

/**
 * Error body of the anomaly API. {@code code} is stable ({@code INVALID_COST_WINDOW}, {@code VALIDATION_ERROR},
 * ...); {@code traceId} matches the {@code X-Request-Trace} response header and the detection log lines.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public static ErrorResponseDto of(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(code, message, details, RequestContextHolder.traceId().orElse(null));
    }
}
