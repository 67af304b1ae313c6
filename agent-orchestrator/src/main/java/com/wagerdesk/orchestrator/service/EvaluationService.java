package com.wagerdesk.orchestrator.service;

import com.wagerdesk.common.edge.SideEdge;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.ledger.WagerTicket;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.DataQuality;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.trace.TraceContextUtil;
import com.wagerdesk.orchestrator.client.LedgerRuleClient;
import com.wagerdesk.orchestrator.context.ContextAssembler;
import com.wagerdesk.orchestrator.judge.DecisionSynthesizer;
import com.wagerdesk.orchestrator.judge.Verdict;
import com.wagerdesk.orchestrator.logger.DecisionFlowLogger;
import com.wagerdesk.orchestrator.model.Action;
import com.wagerdesk.orchestrator.model.EvaluationRequest;
import com.wagerdesk.orchestrator.model.EvaluationResult;
import com.wagerdesk.orchestrator.pipeline.AnalysisStages;
import com.wagerdesk.orchestrator.pipeline.PipelineRouter;
import com.wagerdesk.orchestrator.pipeline.PipelineRun;
import com.wagerdesk.orchestrator.pipeline.PipelineState;
import com.wagerdesk.orchestrator.publisher.LedgerWagerPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coordinates one evaluation: drives the {@link PipelineRouter} state machine to a terminal
 * state, then synthesizes the decision and records actionable ones in the ledger.
 *
 * <p>Never emits an error: unexpected failures collapse into a NO_RECOMMENDATION result with
 * {@link DataQuality#UNAVAILABLE}.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);
    private static final double UNAVAILABLE_CONFIDENCE = 0.10;

    private final ContextAssembler contextAssembler;
    private final AnalysisStages stages;
    private final PipelineRouter router;
    private final DecisionSynthesizer synthesizer;
    private final LedgerRuleClient ruleClient;
    private final LedgerWagerPublisher wagerPublisher;
    private final DecisionFlowLogger decisionFlowLogger;

    public EvaluationService(ContextAssembler contextAssembler,
                             AnalysisStages stages,
                             PipelineRouter router,
                             DecisionSynthesizer synthesizer,
                             LedgerRuleClient ruleClient,
                             LedgerWagerPublisher wagerPublisher,
                             DecisionFlowLogger decisionFlowLogger) {
        this.contextAssembler = contextAssembler;
        this.stages = stages;
        this.router = router;
        this.synthesizer = synthesizer;
        this.ruleClient = ruleClient;
        this.wagerPublisher = wagerPublisher;
        this.decisionFlowLogger = decisionFlowLogger;
    }

    public Mono<EvaluationResult> evaluate(EvaluationRequest request, String traceId) {
        List<String> problems = request.problems();
        if (!problems.isEmpty()) {
            log.warn("[Evaluation] Rejected malformed request. problems={} traceId={}", problems, traceId);
            return Mono.just(unavailable(request, traceId, problems, 0, PipelineState.AWAITING_CONTEXT));
        }

        Mono<EvaluationResult> pipeline = advance(PipelineRun.start(request, traceId))
            .flatMap(this::conclude)
            .onErrorResume(e -> {
                log.error("[Evaluation] Pipeline failed unexpectedly. betType={} traceId={}",
                          request.betType(), traceId, e);
                return Mono.just(unavailable(request, traceId, List.of("pipeline: " + e.getMessage()),
                                             0, PipelineState.DONE));
            });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    /**
     * Runs stages until the router reports a terminal state. Each step either adds an artifact
     * or spends a retry, so the recursion is bounded.
     */
    Mono<PipelineRun> advance(PipelineRun run) {
        PipelineState next = router.route(run);
        switch (next) {
            case AWAITING_CONTEXT:
                return fetchContext(run).flatMap(this::advance);
            case RETRY: {
                PipelineRun retry = run.forRetry();
                decisionFlowLogger.logRun(DecisionFlowLogger.CONTEXT_RETRY, retry);
                return fetchContext(retry).flatMap(this::advance);
            }
            case CONTEXT_FETCHED:
                return Mono.fromCallable(() -> stages.project(run)).flatMap(this::advance);
            case PROJECTED:
                return Mono.fromCallable(() -> stages.simulate(run))
                    .doOnNext(r -> decisionFlowLogger.logRun(DecisionFlowLogger.SIMULATED, r))
                    .flatMap(this::advance);
            case SIMULATED:
                return Mono.fromCallable(() -> stages.debate(run))
                    .doOnNext(r -> decisionFlowLogger.logRun(DecisionFlowLogger.DEBATED, r))
                    .flatMap(this::advance);
            default:
                return Mono.just(run.withState(next));
        }
    }

    private Mono<PipelineRun> fetchContext(PipelineRun run) {
        return contextAssembler.assemble(run.request(), run.assembly())
            .map(run::withAssembly)
            .onErrorResume(e -> {
                log.warn("[Evaluation] Context fetch failed (non-fatal). attempt={} traceId={} reason={}",
                         run.contextAttempts() + 1, run.traceId(), e.getMessage());
                return Mono.just(run.withContextFailure("context: " + e.getMessage()));
            })
            .doOnNext(r -> {
                if (r.context() != null) decisionFlowLogger.logRun(DecisionFlowLogger.CONTEXT_FETCHED, r);
            });
    }

    private Mono<EvaluationResult> conclude(PipelineRun run) {
        if (run.state() == PipelineState.DATA_UNAVAILABLE) {
            decisionFlowLogger.logRun(DecisionFlowLogger.DATA_UNAVAILABLE, run);
            return Mono.just(unavailableRun(run, run.errors()));
        }
        DataQuality quality = quality(run);
        if (run.simulation() == null) {
            Verdict verdict = synthesizer.synthesize(run, quality, List.of());
            EvaluationResult result = toResult(run, quality, verdict);
            decisionFlowLogger.logDecision(result);
            return Mono.just(result);
        }

        return ruleClient.activeRules(run.request().betType())
            .map(rules -> synthesizer.synthesize(run, quality, rules))
            .flatMap(verdict -> {
                EvaluationResult result = toResult(run, quality, verdict);
                decisionFlowLogger.logDecision(result);
                Mono<Void> triggers = verdict.appliedRules().isEmpty()
                    ? Mono.empty()
                    : ruleClient.markTriggered(verdict.appliedRules());
                if (!verdict.action().isActionable()) {
                    return triggers.thenReturn(result);
                }
                if (run.request().eventId() == null || run.request().eventId().isBlank()) {
                    log.info("[Evaluation] Actionable result not recorded, no event id. traceId={}", run.traceId());
                    return triggers.thenReturn(result);
                }
                return triggers.then(wagerPublisher.publish(ticket(run, verdict)))
                    .doOnNext(id -> decisionFlowLogger.logWithTraceId(DecisionFlowLogger.WAGER_RECORDED, run.traceId()))
                    .map(result::withWagerId)
                    .defaultIfEmpty(result);
            });
    }

    static DataQuality quality(PipelineRun run) {
        if (run.context() == null) return DataQuality.UNAVAILABLE;
        return run.missing().isEmpty() && run.errors().isEmpty() ? DataQuality.FRESH : DataQuality.PARTIAL;
    }

    private EvaluationResult toResult(PipelineRun run, DataQuality quality, Verdict verdict) {
        EvaluationRequest request = run.request();
        return new EvaluationResult(
            run.traceId(), request.eventId(), request.betType(),
            selectionLabel(run), run.selection(), run.line(),
            verdict.action(), verdict.confidence(), quality, verdict.reasoning(),
            run.projection(), run.simulation(), run.scenarios(), run.edge(), run.debate(),
            run.errors(), run.missing(), run.flags(), verdict.appliedRules(),
            null, run.retries(), run.state());
    }

    private EvaluationResult unavailableRun(PipelineRun run, List<String> errors) {
        List<ErrorKind> flags = new ArrayList<>(run.flags());
        flags.add(ErrorKind.DATA_UNAVAILABLE);
        EvaluationRequest request = run.request();
        return new EvaluationResult(
            run.traceId(), request.eventId(), request.betType(), null, request.direction(), request.line(),
            Action.NO_RECOMMENDATION, UNAVAILABLE_CONFIDENCE, DataQuality.UNAVAILABLE,
            "No usable context after " + run.contextAttempts() + " attempts",
            null, null, null, null, null,
            errors, run.missing(), flags, List.of(), null, run.retries(), run.state());
    }

    private EvaluationResult unavailable(EvaluationRequest request, String traceId, List<String> errors,
                                         int retries, PipelineState state) {
        return new EvaluationResult(
            traceId, request.eventId(), request.betType(), null, request.direction(), request.line(),
            Action.NO_RECOMMENDATION, UNAVAILABLE_CONFIDENCE, DataQuality.UNAVAILABLE,
            "Request could not be evaluated",
            null, null, null, null, null,
            errors, List.of(), List.of(ErrorKind.DATA_UNAVAILABLE), List.of(), null, retries, state);
    }

    WagerTicket ticket(PipelineRun run, Verdict verdict) {
        EvaluationRequest request = run.request();
        SideEdge side = run.edge().side(run.selection());
        SideContext sideA = run.context().sideA();
        return new WagerTicket(
            request.eventId(), run.traceId(), request.betType(), run.selection(), selectionLabel(run),
            sideA.entityId(), request.isProp() ? request.stat() : null,
            run.line(), side.odds(), verdict.confidence(), side.adjustedEdge(), side.kellyStake(),
            request.depth().name().toLowerCase(Locale.ROOT),
            run.projection(), run.simulation(), run.debate(), verdict.appliedRules());
    }

    /**
     * {@code "OVER 220.5"}, {@code "Boston -4.5"}, {@code "Denver ML"} or
     * {@code "J. Doe points UNDER 27.5"}.
     */
    static String selectionLabel(PipelineRun run) {
        Direction selection = run.selection();
        Context ctx = run.context();
        if (selection == null || ctx == null) return null;
        Double line = run.line();
        BetType betType = run.request().betType();
        switch (betType) {
            case TOTAL:
                return line == null ? selection.name() : selection.name() + " " + line;
            case PLAYER_PROP: {
                String base = ctx.sideA().name() + " " + run.request().stat() + " " + selection.name();
                return line == null ? base : base + " " + line;
            }
            case MONEYLINE:
                return sideName(ctx, selection) + " ML";
            default: {
                String name = sideName(ctx, selection);
                if (line == null) return name;
                double handicap = selection == Direction.SIDE_B ? -line : line;
                return name + " " + (handicap > 0 ? "+" : "") + handicap;
            }
        }
    }

    private static String sideName(Context ctx, Direction selection) {
        SideContext side = selection == Direction.SIDE_B ? ctx.sideB() : ctx.sideA();
        return side != null ? side.name() : selection.name();
    }
}
