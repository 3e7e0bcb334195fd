package com.growthlens.kpi.tracing;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-bound trace id for the current request or scheduled run, mirrored into the logging MDC.
 */
public final class TraceContext {

    public static final String MDC_KEY = "trace_id";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceContext() {
    }

    public static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    public static Optional<String> traceId() {
        return Optional.ofNullable(TRACE_ID.get());
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }
}
