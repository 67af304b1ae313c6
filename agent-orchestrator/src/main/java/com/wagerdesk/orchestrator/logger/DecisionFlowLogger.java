package com.wagerdesk.orchestrator.logger;

import com.wagerdesk.common.trace.TraceContextUtil;
import com.wagerdesk.orchestrator.model.EvaluationResult;
import com.wagerdesk.orchestrator.pipeline.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an evaluation's journey through the pipeline. Pure side effects.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}     evaluation accepted by the controller</li>
 *   <li>{@link #CONTEXT_FETCHED}      a usable context was assembled</li>
 *   <li>{@link #CONTEXT_RETRY}        context unusable, refetching missing parts</li>
 *   <li>{@link #SIMULATED}            simulation and edge computed</li>
 *   <li>{@link #DEBATED}              both argument catalogs ran</li>
 *   <li>{@link #DECISION_SYNTHESIZED} judge produced the action and confidence</li>
 *   <li>{@link #WAGER_RECORDED}       actionable recommendation persisted</li>
 *   <li>{@link #RESPONSE_SENT}        result handed back to the caller</li>
 * </ol>
 * {@link #DATA_UNAVAILABLE} replaces the tail when the retry budget runs out.
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.RESPONSE_SENT))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String CONTEXT_FETCHED      = "CONTEXT_FETCHED";
    public static final String CONTEXT_RETRY        = "CONTEXT_RETRY";
    public static final String SIMULATED            = "SIMULATED";
    public static final String DEBATED              = "DEBATED";
    public static final String DECISION_SYNTHESIZED = "DECISION_SYNTHESIZED";
    public static final String WAGER_RECORDED       = "WAGER_RECORDED";
    public static final String DATA_UNAVAILABLE     = "DATA_UNAVAILABLE";
    public static final String RESPONSE_SENT        = "RESPONSE_SENT";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only, bridging
     * the Reactor Context trace id to MDC for the duration of the call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** Logs a stage when the trace id is carried by the run itself. */
    public void logRun(String stageName, PipelineRun run) {
        TraceContextUtil.withMdc(run.traceId(), () ->
            log.info("[DecisionFlow] stage={} betType={} attempts={} retries={} missing={} errors={} traceId={}",
                     stageName, run.request().betType(), run.contextAttempts(), run.retries(),
                     run.missing().size(), run.errors().size(), run.traceId())
        );
    }

    public void logDecision(EvaluationResult result) {
        TraceContextUtil.withMdc(result.traceId(), () ->
            log.info("[DecisionFlow] stage={} action={} selection={} confidence={} dataQuality={} "
                     + "rulesApplied={} traceId={}",
                     DECISION_SYNTHESIZED, result.action(), result.selection(), result.confidence(),
                     result.dataQuality(), result.appliedRules().size(), result.traceId())
        );
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
        );
    }
}
