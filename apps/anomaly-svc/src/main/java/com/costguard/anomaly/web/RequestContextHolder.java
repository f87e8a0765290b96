package com.costguard.anomaly.web;

import java.util.Optional;

/**
 * Per-thread view of the API request being served, so detection responses and error bodies can echo the trace id
 * without threading it through the detection pipeline. Empty on scheduler threads.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    /** Method and path of the current request, e.g. {@code POST /api/v1/anomalies/detect}. */
    public static Optional<String> endpoint() {
        return get().map(RequestContext::endpoint);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, String endpoint) {
    }
}
