package com.signalfusion.orchestrator.logger;

import com.signalfusion.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for the per-symbol fusion pipeline. Side effects only.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #TASK_RECEIVED}</li>
 *   <li>{@link #SPECIALISTS_COMPLETED}: every dispatched specialist succeeded, timed out or failed</li>
 *   <li>{@link #QUORUM_CHECKED}</li>
 *   <li>{@link #CONSENSUS_MERGED}: base weighted consensus computed</li>
 *   <li>{@link #ENRICHMENT_BLENDED}: second pass applied, or skipped with weight 0</li>
 *   <li>{@link #VALIDATED}</li>
 *   <li>{@link #SIZED}</li>
 *   <li>{@link #PUBLISHED}</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineFlowLogger.SPECIALISTS_COMPLETED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String TASK_RECEIVED         = "TASK_RECEIVED";
    public static final String SPECIALISTS_COMPLETED = "SPECIALISTS_COMPLETED";
    public static final String QUORUM_CHECKED        = "QUORUM_CHECKED";
    public static final String CONSENSUS_MERGED      = "CONSENSUS_MERGED";
    public static final String ENRICHMENT_BLENDED    = "ENRICHMENT_BLENDED";
    public static final String VALIDATED             = "VALIDATED";
    public static final String SIZED                 = "SIZED";
    public static final String PUBLISHED             = "PUBLISHED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}. Trace id and
     * symbol are read from the signal's Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.traceId(signal.getContextView());
            String symbol = TraceContextUtil.symbol(signal.getContextView());
            log(stageName, traceId, symbol);
        };
    }

    public void log(String stageName, String traceId, String symbol) {
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[FusionFlow] stage={} symbol={} traceId={}", stageName, symbol, traceId)
        );
    }

    /** Stage line with a free-form detail, e.g. the merged action and score. */
    public void log(String stageName, String traceId, String symbol, String detail) {
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[FusionFlow] stage={} symbol={} {} traceId={}", stageName, symbol, detail, traceId)
        );
    }
}
