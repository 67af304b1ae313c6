package com.wagerdesk.orchestrator.model;

import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.edge.EdgeResult;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.DataQuality;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.simulation.ScenarioReport;
import com.wagerdesk.common.simulation.SimulationResult;
import com.wagerdesk.orchestrator.pipeline.PipelineState;

import java.util.List;

/**
 * Structured answer to an {@link EvaluationRequest}. Every terminal state produces one; stage
 * artifacts that were never reached are {@code null}.
 *
 * @param selection     human-readable selection, e.g. {@code "UNDER 228.5"}
 * @param flags         non-fatal conditions met along the way (insufficient sample, no line)
 * @param appliedRules  learning rules whose adjustment moved the confidence
 * @param wagerId       ledger id when the recommendation was persisted
 */
public record EvaluationResult(
    String traceId,
    String eventId,
    BetType betType,
    String selection,
    Direction direction,
    Double line,
    Action action,
    double confidence,
    DataQuality dataQuality,
    String reasoning,
    Projection projection,
    SimulationResult simulation,
    ScenarioReport scenarios,
    EdgeResult edge,
    DebateResult debate,
    List<String> errors,
    List<String> missing,
    List<ErrorKind> flags,
    List<Long> appliedRules,
    Long wagerId,
    int retries,
    PipelineState finalState
) {
    public EvaluationResult {
        errors       = errors == null ? List.of() : List.copyOf(errors);
        missing      = missing == null ? List.of() : List.copyOf(missing);
        flags        = flags == null ? List.of() : List.copyOf(flags);
        appliedRules = appliedRules == null ? List.of() : List.copyOf(appliedRules);
    }

    public EvaluationResult withWagerId(Long id) {
        return new EvaluationResult(traceId, eventId, betType, selection, direction, line, action, confidence,
                                    dataQuality, reasoning, projection, simulation, scenarios, edge, debate,
                                    errors, missing, flags, appliedRules, id, retries, finalState);
    }
}
