package com.signalfusion.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace propagation for reactive fusion pipelines.
 *
 * <p>The Reactor Context carries {@code traceId} and {@code symbol} for the whole pipeline.
 * MDC is written only while a single log statement runs, then cleared, because reactive
 * operators hop threads and a lingering ThreadLocal would tag unrelated work.
 *
 * <pre>
 *     return TraceContextUtil.withTrace(pipeline, traceId, symbol);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.withMdc(
 *         TraceContextUtil.traceId(signal.getContextView()), symbol, () -> log.info(...)))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String SYMBOL_KEY   = "symbol";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores trace id and symbol in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} is visible to every operator upstream of it.
     */
    public static <T> Mono<T> withTrace(Mono<T> mono, String traceId, String symbol) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId)
                                           .put(SYMBOL_KEY, symbol == null ? "-" : symbol));
    }

    /** Trace id from the context, or {@code "unknown"}. */
    public static String traceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Symbol from the context, or {@code "-"}. */
    public static String symbol(ContextView ctx) {
        return ctx.getOrDefault(SYMBOL_KEY, "-");
    }

    /**
     * Runs {@code logAction} with {@code traceId} and {@code symbol} in MDC, then removes both.
     * Only for logging side effects.
     */
    public static void withMdc(String traceId, String symbol, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(SYMBOL_KEY, symbol == null ? "-" : symbol);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(SYMBOL_KEY);
        }
    }
}
