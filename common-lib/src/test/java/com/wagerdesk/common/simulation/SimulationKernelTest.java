package com.wagerdesk.common.simulation;

import com.wagerdesk.common.model.PropDistribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Numerical contract of {@link SimulationKernel}: probabilities partition the draws, fixed
 * seeds reproduce runs exactly, and unseeded runs converge to the analytic answer.
 */
class SimulationKernelTest {

    private static final SimulationParameters SEEDED = SimulationParameters.defaults().withSeed(42L);

    // ── Probability partition ─────────────────────────────────────────────

    @Nested
    @DisplayName("over + under + push = 1")
    class Partition {

        @Test
        @DisplayName("normal mode")
        void normalMode() {
            SimulationResult r = SimulationKernel.simulateTotal(112, 108, 12, 12, 220.5, SEEDED);
            assertEquals(1.0, r.pOver() + r.pUnder() + r.pPush(), 1e-6);
        }

        @Test
        @DisplayName("skew mode")
        void skewMode() {
            SimulationResult r = SimulationKernel.simulateTotal(112, 108, 12, 12, 220.5, SEEDED.withSkewMode(true));
            assertEquals(1.0, r.pOver() + r.pUnder() + r.pPush(), 1e-6);
        }

        @Test
        @DisplayName("discrete prop stat with an integer line produces pushes and still partitions")
        void propPushes() {
            PropDistribution threes = new PropDistribution("3pm", 3.0, 1.5, 34, 4);
            SimulationResult r = SimulationKernel.simulateProp(threes, 3.0, SEEDED, PropSimulationParameters.defaults());
            assertTrue(r.pPush() > 0.05, "Poisson draws land exactly on the line");
            assertEquals(1.0, r.pOver() + r.pUnder() + r.pPush(), 1e-6);
        }

        @Test
        @DisplayName("spread result partitions with line = -handicap")
        void spreadPartition() {
            SimulationResult r = SimulationKernel.simulateSpread(115, 105, 12, 12, -5.5, SEEDED);
            assertEquals(5.5, r.line(), 1e-12);
            assertEquals(1.0, r.pOver() + r.pUnder() + r.pPush(), 1e-6);
            assertTrue(r.pOver() > 0.55, "ten-point favourite covers 5.5 more often than not");
        }
    }

    // ── Determinism ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("seeded determinism")
    class Determinism {

        @Test
        @DisplayName("same seed → bit-identical probabilities and bands")
        void sameSeedIdentical() {
            SimulationResult first  = SimulationKernel.simulateTotal(114, 110, 12, 13, 224.5, SEEDED);
            SimulationResult second = SimulationKernel.simulateTotal(114, 110, 12, 13, 224.5, SEEDED);
            assertEquals(Double.doubleToLongBits(first.pOver()), Double.doubleToLongBits(second.pOver()));
            assertEquals(Double.doubleToLongBits(first.pUnder()), Double.doubleToLongBits(second.pUnder()));
            assertEquals(first.percentiles(), second.percentiles());
            assertEquals(first.extremeEvents(), second.extremeEvents());
        }

        @Test
        @DisplayName("skew mode and props are reproducible too")
        void otherModesReproducible() {
            SimulationParameters skew = SEEDED.withSkewMode(true);
            assertEquals(SimulationKernel.simulateTotal(110, 110, 12, 12, 225, skew),
                         SimulationKernel.simulateTotal(110, 110, 12, 12, 225, skew));
            PropDistribution pts = new PropDistribution("points", 25, 6, 34, 4);
            PropSimulationParameters prop = PropSimulationParameters.defaults();
            assertEquals(SimulationKernel.simulateProp(pts, 24.5, SEEDED, prop),
                         SimulationKernel.simulateProp(pts, 24.5, SEEDED, prop));
        }

        @Test
        @DisplayName("different seeds → different draws")
        void differentSeedsDiffer() {
            SimulationResult a = SimulationKernel.simulateTotal(114, 110, 12, 13, 224.5, SEEDED);
            SimulationResult b = SimulationKernel.simulateTotal(114, 110, 12, 13, 224.5, SEEDED.withSeed(7L));
            assertNotEquals(a.mean(), b.mean());
        }
    }

    // ── Convergence ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("unseeded convergence")
    class Convergence {

        private final SimulationParameters noOvertime = SimulationParameters.defaults()
            .withOvertimeProbability(0.0).withDraws(40_000);

        @Test
        @DisplayName("line at the mean → P(over) ≈ 0.5")
        void lineAtMean() {
            SimulationResult r = SimulationKernel.simulateTotal(110, 110, 12, 12, 220, noOvertime);
            assertEquals(0.5, r.pOver(), 0.02);
            assertEquals(220, r.mean(), 0.5);
        }

        @Test
        @DisplayName("line one σ below the mean → P(over) ≈ Φ(1) = 0.841")
        void lineOneSigmaBelow() {
            double rho = SimulationParameters.EMPIRICAL_CORRELATION;
            double sigma = Math.sqrt(2 * 144 + 2 * rho * 144);
            SimulationResult r = SimulationKernel.simulateTotal(110, 110, 12, 12, 220 - sigma, noOvertime);
            assertEquals(0.8413, r.pOver(), 0.015);
            assertEquals(sigma, r.stdDev(), 0.4);
        }
    }

    // ── Summary statistics ────────────────────────────────────────────────

    @Nested
    @DisplayName("summary statistics")
    class Summary {

        @Test
        @DisplayName("percentile bands are ordered and bracket the median")
        void percentilesOrdered() {
            SimulationResult r = SimulationKernel.simulateTotal(112, 108, 12, 12, 220.5, SEEDED);
            double previous = Double.NEGATIVE_INFINITY;
            for (int q : SimulationKernel.PERCENTILES) {
                double v = r.percentiles().get(q);
                assertTrue(v >= previous);
                previous = v;
            }
            assertEquals(r.median(), r.percentiles().get(50), 1e-12);
            assertTrue(r.min() <= r.percentiles().get(5));
            assertTrue(r.max() >= r.percentiles().get(95));
        }

        @Test
        @DisplayName("standard error = √(p(1−p)/n) and the CI is ±1.96·SE")
        void standardError() {
            SimulationResult r = SimulationKernel.simulateTotal(112, 108, 12, 12, 220.5, SEEDED);
            double expected = Math.sqrt(r.pOver() * (1 - r.pOver()) / r.draws());
            assertEquals(expected, r.seOver(), 1e-12);
            assertEquals(r.pOver() - 1.96 * expected, r.ci95Over().lower(), 1e-12);
            assertEquals(r.pOver() + 1.96 * expected, r.ci95Over().upper(), 1e-12);
        }

        @Test
        @DisplayName("percentile interpolates between ranks")
        void percentileInterpolates() {
            double[] sorted = {1, 2, 3, 4, 5};
            assertEquals(3.0, SimulationKernel.percentile(sorted, 50), 1e-12);
            assertEquals(1.2, SimulationKernel.percentile(sorted, 5), 1e-12);
        }
    }

    // ── Overtime & floor ──────────────────────────────────────────────────

    @Nested
    @DisplayName("overtime and floor")
    class OvertimeAndFloor {

        @Test
        @DisplayName("overtime probability 1 → every draw is an extreme event and the total rises")
        void alwaysOvertime() {
            SimulationParameters always = SEEDED.withOvertimeProbability(1.0);
            SimulationParameters never  = SEEDED.withOvertimeProbability(0.0);
            SimulationResult withOt = SimulationKernel.simulateTotal(110, 110, 12, 12, 220, always);
            SimulationResult noOt   = SimulationKernel.simulateTotal(110, 110, 12, 12, 220, never);
            assertEquals(withOt.draws(), withOt.extremeEvents());
            assertEquals(0, noOt.extremeEvents());
            assertTrue(withOt.mean() > noOt.mean() + 10);
        }

        @Test
        @DisplayName("no side scores below the floor")
        void sideFloor() {
            SimulationParameters never = SEEDED.withOvertimeProbability(0.0);
            SimulationResult r = SimulationKernel.simulateTotal(60, 60, 20, 20, 140, never);
            assertTrue(r.min() >= 2 * never.sideFloor());
        }
    }

    @Test
    @DisplayName("standardized skew-normal has mean ≈ 0 and variance ≈ 1")
    void skewNormalStandardized() {
        Random rng = new Random(3);
        int n = 50_000;
        double sum = 0;
        double sq = 0;
        for (int i = 0; i < n; i++) {
            double x = SimulationKernel.standardSkewNormal(2.0, rng);
            sum += x;
            sq += x * x;
        }
        double mean = sum / n;
        assertEquals(0.0, mean, 0.03);
        assertEquals(1.0, sq / n - mean * mean, 0.05);
    }

    @Test
    @DisplayName("invalid parameters are rejected")
    void invalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> SimulationParameters.defaults().withDraws(0));
        assertThrows(IllegalArgumentException.class, () -> SimulationParameters.defaults().withCorrelation(1.5));
    }
}
