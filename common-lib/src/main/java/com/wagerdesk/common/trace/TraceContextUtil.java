package com.wagerdesk.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the evaluation trace id through reactive pipelines.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the duration of a single log
 * statement, so thread hops inside a pipeline never leak ids between requests.
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.withMdc(TraceContextUtil.getTraceId(signal.getContextView()), () -> log.info(...)))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, or {@link #UNKNOWN}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
