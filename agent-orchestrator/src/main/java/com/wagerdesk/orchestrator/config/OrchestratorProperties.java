package com.wagerdesk.orchestrator.config;

import com.wagerdesk.common.debate.DebateParameters;
import com.wagerdesk.common.edge.EdgeParameters;
import com.wagerdesk.common.projection.ProjectionParameters;
import com.wagerdesk.common.simulation.SimulationParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables of the evaluation pipeline. Every backtest-derived constant is exposed here so it can
 * be revalidated without a release; anything left unset falls back to the engine defaults.
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator")
public record OrchestratorProperties(
    /**
     * Context refetches allowed after the first attempt before the run ends as DATA_UNAVAILABLE.
     */
    @Min(0) @Max(10) Integer maxRetries,
    @Valid Simulation simulation,
    @Valid Edge edge,
    @Valid Projection projection,
    @Valid Debate debate,
    @Valid Ledger ledger
) {
    public OrchestratorProperties {
        if (maxRetries == null) maxRetries = 2;
        if (simulation == null) simulation = new Simulation(null, null, null, null, null);
        if (edge == null) edge = new Edge(null, null, null, null, null);
        if (projection == null) projection = new Projection(null, null, null, null, null, null);
        if (debate == null) debate = new Debate(null, null);
        if (ledger == null) ledger = new Ledger(null, null);
    }

    public record Simulation(
        @Positive Integer draws,
        @DecimalMin("-1.0") @DecimalMax("1.0") Double correlation,
        Double skewness,
        @DecimalMin("0.0") @DecimalMax("1.0") Double overtimeProbability,
        @Positive Integer scenarioDraws
    ) {
        public Simulation {
            SimulationParameters d = SimulationParameters.defaults();
            if (draws == null) draws = d.draws();
            if (correlation == null) correlation = d.correlation();
            if (skewness == null) skewness = d.skewness();
            if (overtimeProbability == null) overtimeProbability = d.overtimeProbability();
            if (scenarioDraws == null) scenarioDraws = 3_000;
        }

        public SimulationParameters toParameters() {
            SimulationParameters d = SimulationParameters.defaults();
            return new SimulationParameters(draws, correlation, false, skewness, overtimeProbability,
                                            d.overtimeMean(), d.overtimeStd(), d.sideFloor(), d.minStdDev(), null);
        }
    }

    public record Edge(
        @DecimalMin("0.0") @DecimalMax("1.0") Double kellyMultiplier,
        @DecimalMin("0.0") @DecimalMax("1.0") Double kellyCap,
        Double betThreshold,
        Double strongThreshold,
        @DecimalMin("0.0") @DecimalMax("1.0") Double overPenalty
    ) {
        public Edge {
            EdgeParameters d = EdgeParameters.defaults();
            if (kellyMultiplier == null) kellyMultiplier = d.kellyMultiplier();
            if (kellyCap == null) kellyCap = d.kellyCap();
            if (betThreshold == null) betThreshold = d.betThreshold();
            if (strongThreshold == null) strongThreshold = d.strongThreshold();
            if (overPenalty == null) overPenalty = d.overPenalty();
        }

        public EdgeParameters toParameters() {
            EdgeParameters d = EdgeParameters.defaults();
            return new EdgeParameters(kellyMultiplier, kellyCap, betThreshold, strongThreshold, overPenalty,
                                      d.defaultOdds(), d.defaultPropOdds());
        }
    }

    /**
     * Rest penalties and bias correction. The timeframe weights stay at their engine defaults.
     */
    public record Projection(
        Double backToBackPenalty,
        Double oneDayRestPenalty,
        Double wellRestedBonus,
        Double biasCorrection,
        Double homeCourtAdvantage,
        @Positive Integer sampleThreshold
    ) {
        public Projection {
            ProjectionParameters d = ProjectionParameters.defaults();
            if (backToBackPenalty == null) backToBackPenalty = d.backToBackPenalty();
            if (oneDayRestPenalty == null) oneDayRestPenalty = d.oneDayRestPenalty();
            if (wellRestedBonus == null) wellRestedBonus = d.wellRestedBonus();
            if (biasCorrection == null) biasCorrection = d.biasCorrection();
            if (homeCourtAdvantage == null) homeCourtAdvantage = d.homeCourtAdvantage();
            if (sampleThreshold == null) sampleThreshold = d.sampleThreshold();
        }

        public ProjectionParameters toParameters() {
            ProjectionParameters d = ProjectionParameters.defaults();
            return new ProjectionParameters(d.teamWeights(), d.propWeights(),
                backToBackPenalty, oneDayRestPenalty, wellRestedBonus, d.wellRestedDays(),
                d.fatiguePointValue(),
                d.headToHeadWeight(), d.headToHeadMinGames(),
                d.strongTrendRate(), d.mildTrendRate(), d.strongTrendNudge(), d.mildTrendNudge(),
                biasCorrection,
                d.defaultStdDev(), sampleThreshold, d.uncertaintyPerGame(),
                homeCourtAdvantage, d.defaultMinutesStd());
        }
    }

    public record Debate(@Positive Integer topK, @DecimalMin("0.0") Double winnerThreshold) {
        public Debate {
            DebateParameters d = DebateParameters.defaults();
            if (topK == null) topK = d.topK();
            if (winnerThreshold == null) winnerThreshold = d.winnerThreshold();
        }

        public DebateParameters toParameters() {
            return new DebateParameters(topK, winnerThreshold);
        }
    }

    public record Ledger(@NotBlank String baseUrl, Duration timeout) {
        public Ledger {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8084";
            if (timeout == null) timeout = Duration.ofSeconds(3);
        }
    }
}
