package com.wagerdesk.common.debate;

import com.wagerdesk.common.TestContexts;
import com.wagerdesk.common.edge.EdgeCalculator;
import com.wagerdesk.common.edge.EdgeParameters;
import com.wagerdesk.common.edge.EdgeResult;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.projection.ProjectionBuilder;
import com.wagerdesk.common.projection.ProjectionParameters;
import com.wagerdesk.common.simulation.SimulationKernel;
import com.wagerdesk.common.simulation.SimulationParameters;
import com.wagerdesk.common.simulation.SimulationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DebateEngineTest {

    private static final SimulationParameters SEEDED = SimulationParameters.defaults().withSeed(5L);

    /** UNDER on a line far above a low-scoring projection: every supporting signal is maximal. */
    private static DebateInput lopsidedUnder() {
        SideContext a = TestContexts.side("a", true, TestContexts.uniform(100, 100, 92, 100, 100, 60, 0),
            new RestProfile(0, true, 4, 8));
        SideContext b = TestContexts.side("b", false, TestContexts.uniform(100, 100, 92, 100, 100, 60, 0),
            new RestProfile(0, true, 4, 8));
        Context ctx = TestContexts.total(a, b, new HeadToHead(5, 190.0, 0.0), 240.0);
        Projection proj = ProjectionBuilder.build(ctx, 240.0, ProjectionParameters.defaults());
        SimulationResult sim = SimulationKernel.simulateTotal(proj.meanA(), proj.meanB(), proj.stdA(), proj.stdB(), 240.0, SEEDED);
        EdgeResult edge = EdgeCalculator.evaluate(Direction.OVER, sim.pOver(), 1.91, sim.pUnder(), 1.91, EdgeParameters.defaults());
        return new DebateInput(ctx, proj, sim, edge, null, Direction.UNDER);
    }

    private static Argument arg(DebateSide side, double strength) {
        return new Argument("R" + strength, side, ArgumentCategory.STATISTICAL, strength, "claim", "why");
    }

    @Nested
    @DisplayName("never one-sided")
    class NeverOneSided {

        @Test
        @DisplayName("opposing side has arguments even when every supporting signal is maximal")
        void opposingAlwaysPresent() {
            DebateResult r = DebateEngine.debate(lopsidedUnder(), DebateParameters.defaults());
            assertFalse(r.supporting().isEmpty());
            assertFalse(r.opposing().isEmpty());
            assertTrue(r.opposing().stream().anyMatch(a -> a.rule().equals(OpposingRule.SAMPLE_SIZE.name())));
        }

        @Test
        @DisplayName("every structural rule fires on any input")
        void structuralRulesFire() {
            DebateInput in = lopsidedUnder();
            for (OpposingRule rule : OpposingRule.values()) {
                if (rule == OpposingRule.MARKET_EFFICIENCY) continue; // suppressed by a large edge
                if (rule.structural()) {
                    assertTrue(rule.evaluate(in).isPresent(), rule.name());
                }
            }
        }

        @Test
        @DisplayName("every argument is tagged with the side that produced it")
        void sidesTagged() {
            DebateResult r = DebateEngine.debate(lopsidedUnder(), DebateParameters.defaults());
            assertTrue(r.supporting().stream().allMatch(a -> a.side() == DebateSide.SUPPORTING));
            assertTrue(r.opposing().stream().allMatch(a -> a.side() == DebateSide.OPPOSING));
        }
    }

    @Nested
    @DisplayName("scoring")
    class Scoring {

        @Test
        @DisplayName("net > 0.1 → SUPPORTING, < −0.1 → OPPOSING, otherwise NEUTRAL")
        void winnerThresholds() {
            DebateParameters p = DebateParameters.defaults();
            assertEquals(DebateWinner.SUPPORTING,
                DebateEngine.score(List.of(arg(DebateSide.SUPPORTING, 0.9)), List.of(arg(DebateSide.OPPOSING, 0.7)), p).winner());
            assertEquals(DebateWinner.OPPOSING,
                DebateEngine.score(List.of(arg(DebateSide.SUPPORTING, 0.5)), List.of(arg(DebateSide.OPPOSING, 0.7)), p).winner());
            assertEquals(DebateWinner.NEUTRAL,
                DebateEngine.score(List.of(arg(DebateSide.SUPPORTING, 0.65)), List.of(arg(DebateSide.OPPOSING, 0.6)), p).winner());
        }

        @Test
        @DisplayName("only the five strongest count; all arguments are retained, strongest first")
        void topFive() {
            List<Argument> supporting = new ArrayList<>();
            for (double s : new double[] {0.1, 0.9, 0.8, 0.2, 0.7, 0.6, 0.5}) {
                supporting.add(arg(DebateSide.SUPPORTING, s));
            }
            DebateResult r = DebateEngine.score(supporting, List.of(arg(DebateSide.OPPOSING, 0.5)), DebateParameters.defaults());
            assertEquals((0.9 + 0.8 + 0.7 + 0.6 + 0.5) / 5, r.supportingStrength(), 1e-12);
            assertEquals(7, r.supporting().size());
            assertEquals(0.9, r.supporting().get(0).strength());
            assertEquals(r.supportingStrength() - r.opposingStrength(), r.net(), 1e-12);
        }

        @Test
        @DisplayName("strengths are clamped to [0, 1]")
        void clamped() {
            assertEquals(1.0, arg(DebateSide.SUPPORTING, 3.0).strength());
            assertEquals(0.0, arg(DebateSide.SUPPORTING, -1.0).strength());
        }
    }

    @Nested
    @DisplayName("rules in isolation")
    class Rules {

        @Test
        @DisplayName("MODEL_EDGE scales edge ×10 and caps at 1")
        void modelEdge() {
            DebateInput in = lopsidedUnder();
            Optional<Argument> a = SupportingRule.MODEL_EDGE.evaluate(in);
            assertTrue(a.isPresent());
            assertEquals(Math.min(in.selectionEdge() * 10, 1.0), a.get().strength(), 1e-12);
        }

        @Test
        @DisplayName("MARKET_EFFICIENCY fires without a priced market")
        void marketEfficiencyWithoutEdge() {
            DebateInput base = lopsidedUnder();
            DebateInput noEdge = new DebateInput(base.context(), base.projection(), base.simulation(), null, null, Direction.UNDER);
            assertTrue(OpposingRule.MARKET_EFFICIENCY.evaluate(noEdge).isPresent());
            assertTrue(SupportingRule.MODEL_EDGE.evaluate(noEdge).isEmpty());
        }

        @Test
        @DisplayName("FATIGUE argues against OVER when a side is on a back-to-back")
        void fatigueAgainstOver() {
            DebateInput base = lopsidedUnder();
            DebateInput over = new DebateInput(base.context(), base.projection(), base.simulation(), base.edge(), null, Direction.OVER);
            assertTrue(OpposingRule.FATIGUE.evaluate(over).isPresent());
            assertTrue(OpposingRule.FATIGUE.evaluate(base).isEmpty());
        }

        @Test
        @DisplayName("every rule runs on every bet type without throwing")
        void rulesTotalOverInputs() {
            DebateInput total = lopsidedUnder();
            SideContext a = TestContexts.plainSide("a", true);
            SideContext b = TestContexts.plainSide("b", false);
            Context spreadCtx = TestContexts.spread(a, b, -3.5);
            Projection proj = ProjectionBuilder.build(spreadCtx, -3.5, ProjectionParameters.defaults());
            SimulationResult sim = SimulationKernel.simulateSpread(proj.meanA(), proj.meanB(), proj.stdA(), proj.stdB(), -3.5, SEEDED);
            DebateInput spread = new DebateInput(spreadCtx, proj, sim, null, null, Direction.SIDE_B);

            for (DebateInput in : List.of(total, spread)) {
                Arrays.stream(SupportingRule.values()).forEach(r -> assertNotNull(r.evaluate(in)));
                Arrays.stream(OpposingRule.values()).forEach(r -> assertNotNull(r.evaluate(in)));
            }
        }
    }
}
