package com.neoplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-id generation and propagation for supervision pipelines.
 *
 * <p>Reactor Context is the single source of truth for the run id inside reactive chains.
 * MDC is only written as a temporary bridge around a log statement.
 *
 * <pre>
 *     String runId = TraceContextUtil.newRunId();          // run_20260412_093015_0001
 *     return TraceContextUtil.withRunId(pipeline, runId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String UNKNOWN_RUN_ID = "unknown";

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final AtomicLong RUN_SEQUENCE = new AtomicLong();

    private TraceContextUtil() {}

    /**
     * New run id of the form {@code run_yyyyMMdd_HHmmss_NNNN}.
     * The process-wide sequence keeps ids distinct when runs start within the same second.
     */
    public static String newRunId() {
        return newRunId(LocalDateTime.now());
    }

    static String newRunId(LocalDateTime startedAt) {
        return String.format("run_%s_%04d", startedAt.format(RUN_ID_FORMAT), RUN_SEQUENCE.incrementAndGet());
    }

    /**
     * Stores {@code runId} in the Reactor Context of {@code mono}.
     * Call at the end of pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Returns the run id stored in {@code ctx}, or {@value #UNKNOWN_RUN_ID}; never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN_RUN_ID);
    }

    /**
     * Bridges {@code runId} into MDC for the duration of {@code logAction}, then removes it.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    /** Same as {@link #withMdc(String, Runnable)} with the run id read from {@code ctx}. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getRunId(ctx), logAction);
    }
}
