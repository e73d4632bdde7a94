package com.pathfinder.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries a request's traceId through a reactive dispatch.
 *
 * <p>The Reactor Context holds the traceId for the lifetime of a pipeline. MDC is only
 * populated for the duration of a single log call, never left on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(dispatch, context.traceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. A null or blank id
     * is stored as {@value #UNKNOWN}.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        String id = traceId == null || traceId.isBlank() ? UNKNOWN : traceId;
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, id));
    }

    /** traceId from the Reactor Context, or {@value #UNKNOWN}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC while {@code logAction} runs, then removes it.
     * Only for logging side-effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
