package com.wagerdesk.orchestrator.pipeline;

import com.wagerdesk.common.debate.DebateEngine;
import com.wagerdesk.common.debate.DebateInput;
import com.wagerdesk.common.debate.DebateParameters;
import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.edge.EdgeCalculator;
import com.wagerdesk.common.edge.EdgeParameters;
import com.wagerdesk.common.edge.EdgeResult;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.MarketLine;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.projection.ProjectionBuilder;
import com.wagerdesk.common.projection.ProjectionParameters;
import com.wagerdesk.common.simulation.PropSimulationParameters;
import com.wagerdesk.common.simulation.ScenarioAnalysis;
import com.wagerdesk.common.simulation.ScenarioReport;
import com.wagerdesk.common.simulation.SimulationKernel;
import com.wagerdesk.common.simulation.SimulationParameters;
import com.wagerdesk.common.simulation.SimulationResult;
import com.wagerdesk.orchestrator.config.OrchestratorProperties;
import com.wagerdesk.orchestrator.model.Depth;
import com.wagerdesk.orchestrator.model.EvaluationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure-compute stages of an evaluation: projection, simulation, edge and debate.
 *
 * <h3>Line resolution</h3>
 * <ol>
 *   <li>an explicit request line wins over the quoted market line</li>
 *   <li>moneylines always simulate against a zero handicap</li>
 *   <li>with no line at all the simulation runs against the projection itself, the edge step is
 *       skipped and the run is flagged {@link ErrorKind#NO_LINE_PROVIDED}</li>
 * </ol>
 *
 * <h3>Selection</h3>
 * The requested direction when given, else the side the edge step recommends, else the side the
 * projection leans to.
 */
@Component
public class AnalysisStages {

    private static final Logger log = LoggerFactory.getLogger(AnalysisStages.class);

    private final ProjectionParameters projectionParameters;
    private final SimulationParameters simulationParameters;
    private final PropSimulationParameters propParameters;
    private final EdgeParameters edgeParameters;
    private final DebateParameters debateParameters;
    private final int scenarioDraws;

    public AnalysisStages(ProjectionParameters projectionParameters,
                          SimulationParameters simulationParameters,
                          PropSimulationParameters propParameters,
                          EdgeParameters edgeParameters,
                          DebateParameters debateParameters,
                          OrchestratorProperties properties) {
        this.projectionParameters = projectionParameters;
        this.simulationParameters = simulationParameters;
        this.propParameters = propParameters;
        this.edgeParameters = edgeParameters;
        this.debateParameters = debateParameters;
        this.scenarioDraws = properties.simulation().scenarioDraws();
    }

    /**
     * Projects a run that holds a usable context. Returns an aborted run when the context
     * cannot be projected.
     */
    public PipelineRun project(PipelineRun run) {
        EvaluationRequest request = run.request();
        Double line = resolveLine(request, run.context());
        List<ErrorKind> flags = new ArrayList<>();

        Projection projection;
        try {
            projection = ProjectionBuilder.build(run.context(), line, projectionParameters);
        } catch (IllegalArgumentException e) {
            log.warn("[Projection] Context could not be projected. betType={} reason={} traceId={}",
                     request.betType(), e.getMessage(), run.traceId());
            return run.abort("projection: " + e.getMessage());
        }
        if (projection.insufficientSample()) flags.add(ErrorKind.INSUFFICIENT_SAMPLE);
        if (line == null) flags.add(ErrorKind.NO_LINE_PROVIDED);

        log.info("[Projection] Built. betType={} estimate={} line={} adjustments={} traceId={}",
                 request.betType(), round2(projection.pointEstimate()), line,
                 round2(projection.adjustmentTotal()), run.traceId());
        return run.withProjection(line, projection, flags);
    }

    /** Simulates the projected market, runs scenario analysis for totals and prices both sides. */
    public PipelineRun simulate(PipelineRun run) {
        EvaluationRequest request = run.request();
        Projection projection = run.projection();
        Double line = run.line();

        SimulationParameters params = parametersFor(request);
        double simLine = line != null ? line : neutralLine(projection);
        SimulationResult sim = runKernel(projection, simLine, params);

        ScenarioReport scenarios = null;
        if (request.betType() == BetType.TOTAL && request.depth() != Depth.QUICK) {
            scenarios = ScenarioAnalysis.run(projection.meanA(), projection.meanB(), projection.stdA(),
                                             projection.stdB(), simLine, params.withDraws(scenarioDraws));
        }

        EdgeResult edge = line == null ? null : price(request.betType(), run.context().market(), sim);
        Direction selection = select(request, projection, edge);

        log.info("[Simulation] Done. betType={} draws={} pOver={} pUnder={} pPush={} selection={} traceId={}",
                 request.betType(), sim.draws(), round2(sim.pOver()), round2(sim.pUnder()),
                 round2(sim.pPush()), selection, run.traceId());
        return run.withSimulation(sim, scenarios, edge, selection);
    }

    public PipelineRun debate(PipelineRun run) {
        DebateInput input = new DebateInput(run.context(), run.projection(), run.simulation(),
                                            run.edge(), run.scenarios(), run.selection());
        DebateResult result = DebateEngine.debate(input, debateParameters);
        log.info("[Debate] Verdict. winner={} net={} supporting={} opposing={} traceId={}",
                 result.winner(), round2(result.net()), result.supporting().size(),
                 result.opposing().size(), run.traceId());
        return run.withDebate(result);
    }

    static Double resolveLine(EvaluationRequest request, Context ctx) {
        if (request.betType() == BetType.MONEYLINE) return 0.0;
        if (request.line() != null) return request.line();
        MarketLine market = ctx.market();
        return market != null ? market.line() : null;
    }

    /** Line that puts the projection exactly on the number. */
    static double neutralLine(Projection projection) {
        return projection.betType() == BetType.SPREAD ? -projection.pointEstimate() : projection.pointEstimate();
    }

    static Direction select(EvaluationRequest request, Projection projection, EdgeResult edge) {
        if (request.direction() != null) return request.direction();
        if (edge != null && edge.recommended() != null) return edge.recommended();
        boolean totalLike = request.betType() == BetType.TOTAL || request.betType() == BetType.PLAYER_PROP;
        boolean leansFirst = projection.marginFromLine() >= 0;
        if (totalLike) return leansFirst ? Direction.OVER : Direction.UNDER;
        return leansFirst ? Direction.SIDE_A : Direction.SIDE_B;
    }

    private SimulationParameters parametersFor(EvaluationRequest request) {
        SimulationParameters params = simulationParameters;
        if (request.seed() != null) params = params.withSeed(request.seed());
        if (request.depth() == Depth.DEEP) params = params.withSkewMode(true);
        return params;
    }

    private SimulationResult runKernel(Projection p, double line, SimulationParameters params) {
        return switch (p.betType()) {
            case TOTAL -> SimulationKernel.simulateTotal(p.meanA(), p.meanB(), p.stdA(), p.stdB(), line, params);
            case SPREAD, MONEYLINE -> SimulationKernel.simulateSpread(p.meanA(), p.meanB(), p.stdA(), p.stdB(), line, params);
            case PLAYER_PROP -> SimulationKernel.simulateProp(p.prop(), line, params, propParameters);
        };
    }

    private EdgeResult price(BetType betType, MarketLine market, SimulationResult sim) {
        Direction first = (betType == BetType.TOTAL || betType == BetType.PLAYER_PROP) ? Direction.OVER : Direction.SIDE_A;
        double fallback = betType == BetType.PLAYER_PROP ? edgeParameters.defaultPropOdds() : edgeParameters.defaultOdds();
        double oddsFirst  = market != null ? usablePrice(market.priceFor(first), fallback) : fallback;
        double oddsSecond = market != null ? usablePrice(market.priceFor(first.opposite()), fallback) : fallback;
        return EdgeCalculator.evaluate(first, sim.pOver(), oddsFirst, sim.pUnder(), oddsSecond, edgeParameters);
    }

    private static double usablePrice(double quoted, double fallback) {
        if (quoted > 1.0) {
            return quoted;
        }
        log.warn("[Edge] Quoted price unusable, using default odds. quoted={} default={}", quoted, fallback);
        return fallback;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
