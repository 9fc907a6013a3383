package com.narrativeplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Per-request trace id plumbing for the service layer.
 *
 * <p>Reactor Context holds the trace id for the life of a request pipeline. MDC
 * is written only for the duration of a single log statement via
 * {@link #withMdc}, never left on the thread.
 *
 * <pre>
 *     String traceId = TraceContextUtil.resolve(headerValue);
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /**
     * Picks the trace id for an incoming request. A caller-supplied
     * {@code X-Trace-Id} is trimmed and kept so a narrative request can be
     * correlated with the dashboard call that issued it.
     *
     * @param headerValue raw {@value #TRACE_ID_HEADER} header value, may be {@code null}
     * @return the trimmed header value, or a random UUID when it is blank
     */
    public static String resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return headerValue.trim();
    }

    /**
     * Stores {@code traceId} in the Reactor Context so the service stages upstream
     * of {@code contextWrite} can read it via {@link #getTraceId(ContextView)}.
     *
     * <p>{@code contextWrite} propagates upstream during subscription, so the
     * controller calls this last, after the service pipeline is assembled.
     *
     * @param mono    the narrative pipeline to enrich
     * @param traceId the trace identifier to propagate
     * @param <T>     pipeline element type
     * @return the same pipeline with traceId stored in its Reactor Context
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Retrieves the trace id from a Reactor {@link ContextView}, typically the one
     * handed to {@code Mono.deferContextual}.
     *
     * @param ctx the Reactor ContextView of the current subscription
     * @return the trace id, or {@code "unknown"} when none was written; never {@code null}
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} so the
     * {@code %X{traceId}} log pattern can print it, then removes the entry. Use only
     * around log statements; worker threads never keep the value.
     *
     * @param traceId   the trace id to expose to the logging pattern
     * @param logAction the log statement(s) to run with MDC populated
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
