package com.wagerdesk.orchestrator.pipeline;

import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.edge.EdgeResult;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.simulation.ScenarioReport;
import com.wagerdesk.common.simulation.SimulationResult;
import com.wagerdesk.orchestrator.context.ContextAssembly;
import com.wagerdesk.orchestrator.model.EvaluationRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one evaluation between stages. Each stage returns a new run carrying
 * the artifact it produced.
 *
 * @param contextAttempts  context fetches performed so far, including the first
 * @param retries          RETRY transitions taken
 * @param context          usable context; {@code null} until one could be assembled
 * @param line             line the market is priced at; {@code null} when none was supplied or quoted
 * @param stageErrors      errors raised by stages after context assembly; cleared on retry
 * @param aborted          a stage failed in a way a refetch cannot fix
 */
public record PipelineRun(
    EvaluationRequest request,
    String traceId,
    PipelineState state,
    ContextAssembly assembly,
    int contextAttempts,
    int retries,
    Context context,
    Double line,
    Projection projection,
    SimulationResult simulation,
    ScenarioReport scenarios,
    EdgeResult edge,
    Direction selection,
    DebateResult debate,
    List<String> stageErrors,
    List<ErrorKind> flags,
    boolean aborted
) {
    public PipelineRun {
        if (assembly == null) assembly = ContextAssembly.empty();
        stageErrors = stageErrors == null ? List.of() : List.copyOf(stageErrors);
        flags       = flags == null ? List.of() : List.copyOf(flags);
    }

    public static PipelineRun start(EvaluationRequest request, String traceId) {
        return new PipelineRun(request, traceId, PipelineState.AWAITING_CONTEXT, ContextAssembly.empty(),
                               0, 0, null, null, null, null, null, null, null, null, List.of(), List.of(), false);
    }

    public PipelineRun withState(PipelineState next) {
        return new PipelineRun(request, traceId, next, assembly, contextAttempts, retries, context, line,
                               projection, simulation, scenarios, edge, selection, debate, stageErrors, flags, aborted);
    }

    /** Enters a retry: prior errors are discarded, fetched context parts are kept. */
    public PipelineRun forRetry() {
        return new PipelineRun(request, traceId, PipelineState.RETRY, assembly, contextAttempts, retries + 1,
                               context, line, projection, simulation, scenarios, edge, selection, debate,
                               List.of(), flags, aborted);
    }

    public PipelineRun withAssembly(ContextAssembly fetched) {
        boolean usable = fetched.isUsable(request);
        return new PipelineRun(request, traceId, usable ? PipelineState.CONTEXT_FETCHED : state, fetched,
                               contextAttempts + 1, retries, usable ? fetched.toContext(request) : null, line,
                               projection, simulation, scenarios, edge, selection, debate, stageErrors, flags, aborted);
    }

    public PipelineRun withContextFailure(String error) {
        return new PipelineRun(request, traceId, state, assembly, contextAttempts + 1, retries, null, line,
                               projection, simulation, scenarios, edge, selection, debate,
                               append(stageErrors, error), flags, aborted);
    }

    public PipelineRun withProjection(Double resolvedLine, Projection p, List<ErrorKind> raised) {
        List<ErrorKind> allFlags = new ArrayList<>(flags);
        for (ErrorKind k : raised) {
            if (!allFlags.contains(k)) allFlags.add(k);
        }
        return new PipelineRun(request, traceId, PipelineState.PROJECTED, assembly, contextAttempts, retries,
                               context, resolvedLine, p, simulation, scenarios, edge, selection, debate,
                               stageErrors, allFlags, aborted);
    }

    public PipelineRun withSimulation(SimulationResult sim, ScenarioReport scenarioReport,
                                      EdgeResult edgeResult, Direction chosen) {
        return new PipelineRun(request, traceId, PipelineState.SIMULATED, assembly, contextAttempts, retries,
                               context, line, projection, sim, scenarioReport, edgeResult, chosen, debate,
                               stageErrors, flags, aborted);
    }

    public PipelineRun withDebate(DebateResult result) {
        return new PipelineRun(request, traceId, PipelineState.DEBATED, assembly, contextAttempts, retries,
                               context, line, projection, simulation, scenarios, edge, selection, result,
                               stageErrors, flags, aborted);
    }

    public PipelineRun abort(String error) {
        return new PipelineRun(request, traceId, state, assembly, contextAttempts, retries, context, line,
                               projection, simulation, scenarios, edge, selection, debate,
                               append(stageErrors, error), flags, true);
    }

    /** Context errors of the latest attempt followed by stage errors. */
    public List<String> errors() {
        List<String> all = new ArrayList<>(assembly.errors());
        all.addAll(stageErrors);
        return all;
    }

    public List<String> missing() {
        return assembly.missing();
    }

    private static List<String> append(List<String> list, String item) {
        List<String> copy = new ArrayList<>(list);
        copy.add(item);
        return copy;
    }
}
