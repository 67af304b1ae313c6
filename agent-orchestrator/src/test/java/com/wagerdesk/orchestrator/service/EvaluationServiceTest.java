package com.wagerdesk.orchestrator.service;

import com.wagerdesk.common.data.DataAccess;
import com.wagerdesk.common.data.EntityRef;
import com.wagerdesk.common.data.Lookup;
import com.wagerdesk.common.debate.DebateParameters;
import com.wagerdesk.common.debate.DebateWinner;
import com.wagerdesk.common.edge.EdgeParameters;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.ledger.RuleAdjustment;
import com.wagerdesk.common.ledger.WagerTicket;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.DataQuality;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.MarketLine;
import com.wagerdesk.common.projection.ProjectionParameters;
import com.wagerdesk.common.simulation.PropSimulationParameters;
import com.wagerdesk.common.simulation.SimulationParameters;
import com.wagerdesk.orchestrator.OrchestratorFixtures;
import com.wagerdesk.orchestrator.client.LedgerRuleClient;
import com.wagerdesk.orchestrator.config.OrchestratorProperties;
import com.wagerdesk.orchestrator.context.ContextAssembler;
import com.wagerdesk.orchestrator.judge.DecisionSynthesizer;
import com.wagerdesk.orchestrator.logger.DecisionFlowLogger;
import com.wagerdesk.orchestrator.model.Action;
import com.wagerdesk.orchestrator.model.Depth;
import com.wagerdesk.orchestrator.model.EvaluationRequest;
import com.wagerdesk.orchestrator.model.EvaluationResult;
import com.wagerdesk.orchestrator.pipeline.AnalysisStages;
import com.wagerdesk.orchestrator.pipeline.PipelineRouter;
import com.wagerdesk.orchestrator.pipeline.PipelineState;
import com.wagerdesk.orchestrator.publisher.LedgerWagerPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.wagerdesk.orchestrator.OrchestratorFixtures.EVENT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives the whole pipeline with real engines against a mocked warehouse and ledger.
 */
@ExtendWith(MockitoExtension.class)
class EvaluationServiceTest {

    @Mock
    private DataAccess dataAccess;

    @Mock
    private LedgerRuleClient ruleClient;

    @Mock
    private LedgerWagerPublisher wagerPublisher;

    private EvaluationService service;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties(null, null, null, null, null, null);
        AnalysisStages stages = new AnalysisStages(
            ProjectionParameters.defaults(),
            SimulationParameters.defaults().withDraws(4_000),
            PropSimulationParameters.defaults(),
            EdgeParameters.defaults(),
            DebateParameters.defaults(),
            props);
        service = new EvaluationService(
            new ContextAssembler(dataAccess),
            stages,
            new PipelineRouter(props.maxRetries()),
            new DecisionSynthesizer(),
            ruleClient,
            wagerPublisher,
            new DecisionFlowLogger());
    }

    @Nested
    @DisplayName("Retry budget")
    class RetryBudget {

        @Test
        @DisplayName("warehouse always failing → DATA_UNAVAILABLE after 1 + maxRetries fetches")
        void terminatesWhenWarehouseIsDown() {
            when(dataAccess.resolveEntity(anyString()))
                .thenReturn(Mono.<Lookup<EntityRef>>error(new IllegalStateException("warehouse down")));

            EvaluationResult result = service.evaluate(OrchestratorFixtures.total(220.5, EVENT_ID), "trace-down").block();

            assertThat(result.finalState()).isEqualTo(PipelineState.DATA_UNAVAILABLE);
            assertThat(result.action()).isEqualTo(Action.NO_RECOMMENDATION);
            assertThat(result.dataQuality()).isEqualTo(DataQuality.UNAVAILABLE);
            assertThat(result.retries()).isEqualTo(2);
            assertThat(result.flags()).contains(ErrorKind.DATA_UNAVAILABLE);
            assertThat(result.errors()).contains("sideA.entity: warehouse down");
            verify(dataAccess, times(3)).resolveEntity("Boston");
            verifyNoInteractions(ruleClient, wagerPublisher);
        }

        @Test
        @DisplayName("an opponent found on the second attempt completes the run")
        void recoversOnRetry() {
            OrchestratorFixtures.healthyWarehouse(dataAccess);
            when(dataAccess.resolveEntity("Denver"))
                .thenReturn(Mono.just(Lookup.notFound("unknown team")))
                .thenReturn(Mono.just(Lookup.found(OrchestratorFixtures.DENVER)));
            when(ruleClient.activeRules(BetType.TOTAL)).thenReturn(Mono.just(List.of()));
            when(wagerPublisher.publish(any())).thenReturn(Mono.just(7L));

            EvaluationResult result = service.evaluate(OrchestratorFixtures.total(null, EVENT_ID), "trace-retry").block();

            assertThat(result.finalState()).isEqualTo(PipelineState.DONE);
            assertThat(result.retries()).isEqualTo(1);
            assertThat(result.dataQuality()).isEqualTo(DataQuality.FRESH);
            verify(dataAccess, times(1)).resolveEntity("Boston");
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("a projection far under the quoted total → actionable UNDER, recorded in the ledger")
        void actionableUnderIsRecorded() {
            OrchestratorFixtures.healthyWarehouse(dataAccess);
            when(ruleClient.activeRules(BetType.TOTAL)).thenReturn(Mono.just(List.of(
                new RuleAdjustment(11L, "0.05", "EDGE_ABOVE", "TOTAL", -0.05))));
            when(ruleClient.markTriggered(List.of(11L))).thenReturn(Mono.empty());
            when(wagerPublisher.publish(any())).thenReturn(Mono.just(42L));

            EvaluationResult result = service.evaluate(OrchestratorFixtures.total(null, EVENT_ID), "trace-under").block();

            assertThat(result.finalState()).isEqualTo(PipelineState.DONE);
            assertThat(result.direction()).isEqualTo(Direction.UNDER);
            assertThat(result.line()).isEqualTo(260.0);
            assertThat(result.selection()).isEqualTo("UNDER 260.0");
            assertThat(result.action()).isIn(Action.BET, Action.LEAN_BET);
            assertThat(result.dataQuality()).isEqualTo(DataQuality.FRESH);
            assertThat(result.appliedRules()).containsExactly(11L);
            assertThat(result.confidence()).isBetween(0.10, 0.85);
            assertThat(result.scenarios()).isNotNull();
            assertThat(result.wagerId()).isEqualTo(42L);

            ArgumentCaptor<WagerTicket> ticket = ArgumentCaptor.forClass(WagerTicket.class);
            verify(wagerPublisher).publish(ticket.capture());
            assertThat(ticket.getValue().eventId()).isEqualTo(EVENT_ID);
            assertThat(ticket.getValue().traceId()).isEqualTo("trace-under");
            assertThat(ticket.getValue().direction()).isEqualTo(Direction.UNDER);
            assertThat(ticket.getValue().entityId()).isEqualTo("t-bos");
            assertThat(ticket.getValue().stat()).isNull();
            assertThat(ticket.getValue().odds()).isEqualTo(1.91);
            assertThat(ticket.getValue().depth()).isEqualTo("standard");
            assertThat(ticket.getValue().appliedRules()).containsExactly(11L);
        }

        @Test
        @DisplayName("quoted price of 0.0 → default odds used, run still completes")
        void unusableQuotedPriceFallsBackToDefault() {
            OrchestratorFixtures.healthyWarehouse(dataAccess);
            when(dataAccess.fetchMarketOdds(EVENT_ID, BetType.TOTAL))
                .thenReturn(Mono.just(Lookup.found(new MarketLine(BetType.TOTAL, 260.0, 1.91, 0.0))));
            when(ruleClient.activeRules(BetType.TOTAL)).thenReturn(Mono.just(List.of()));
            when(wagerPublisher.publish(any())).thenReturn(Mono.just(7L));

            EvaluationResult result = service.evaluate(OrchestratorFixtures.total(null, EVENT_ID), "trace-price").block();

            assertThat(result.finalState()).isEqualTo(PipelineState.DONE);
            assertThat(result.dataQuality()).isEqualTo(DataQuality.FRESH);
            assertThat(result.edge()).isNotNull();
            assertThat(result.direction()).isEqualTo(Direction.UNDER);

            ArgumentCaptor<WagerTicket> ticket = ArgumentCaptor.forClass(WagerTicket.class);
            verify(wagerPublisher).publish(ticket.capture());
            assertThat(ticket.getValue().odds()).isEqualTo(1.91);
        }

        @Test
        @DisplayName("ledger unreachable → result still returned without a wager id")
        void ledgerDownIsNonFatal() {
            OrchestratorFixtures.healthyWarehouse(dataAccess);
            when(ruleClient.activeRules(BetType.TOTAL)).thenReturn(Mono.just(List.of()));
            when(wagerPublisher.publish(any())).thenReturn(Mono.empty());

            EvaluationResult result = service.evaluate(OrchestratorFixtures.total(null, EVENT_ID), "trace-ledger").block();

            assertThat(result.action()).isIn(Action.BET, Action.LEAN_BET);
            assertThat(result.wagerId()).isNull();
        }

        @Test
        @DisplayName("no line anywhere → NEED_LINE, flagged, nothing recorded")
        void needLine() {
            OrchestratorFixtures.healthyWarehouse(dataAccess);
            when(ruleClient.activeRules(BetType.TOTAL)).thenReturn(Mono.just(List.of()));

            EvaluationResult result = service.evaluate(OrchestratorFixtures.total(null, null), "trace-noline").block();

            assertThat(result.action()).isEqualTo(Action.NEED_LINE);
            assertThat(result.flags()).contains(ErrorKind.NO_LINE_PROVIDED);
            assertThat(result.edge()).isNull();
            assertThat(result.simulation()).isNotNull();
            verifyNoInteractions(wagerPublisher);
        }

        @Test
        @DisplayName("quick depth skips scenario analysis")
        void quickDepthSkipsScenarios() {
            OrchestratorFixtures.healthyWarehouse(dataAccess);
            when(ruleClient.activeRules(BetType.TOTAL)).thenReturn(Mono.just(List.of()));
            EvaluationRequest quick = new EvaluationRequest(BetType.TOTAL, "Boston", "Denver", true, null, 260.0,
                                                            null, null, OrchestratorFixtures.GAME_DATE, Depth.QUICK, 42L);

            EvaluationResult result = service.evaluate(quick, "trace-quick").block();

            assertThat(result.scenarios()).isNull();
            assertThat(result.simulation()).isNotNull();
        }

        @Test
        @DisplayName("malformed request is answered without touching the warehouse")
        void malformedRequest() {
            EvaluationRequest noStat = new EvaluationRequest(BetType.PLAYER_PROP, "Jay Doe", null, false, null,
                                                             25.5, null, null, null, null, null);

            EvaluationResult result = service.evaluate(noStat, "trace-bad").block();

            assertThat(result.action()).isEqualTo(Action.NO_RECOMMENDATION);
            assertThat(result.errors()).contains("stat is required for player props");
            verifyNoInteractions(dataAccess, ruleClient, wagerPublisher);
        }
    }

    @Test
    @DisplayName("selection labels name the side and signed handicap")
    void selectionLabels() {
        assertThat(EvaluationService.selectionLabel(
            OrchestratorFixtures.debatedRun(Direction.OVER, 0.04, 0.6, DebateWinner.NEUTRAL)))
            .isEqualTo("OVER 220.5");
    }
}
