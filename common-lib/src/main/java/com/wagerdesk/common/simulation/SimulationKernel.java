package com.wagerdesk.common.simulation;

import com.wagerdesk.common.model.PropDistribution;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Monte Carlo scoring kernel.
 *
 * <p>Each draw produces a correlated score pair for the two sides:
 * <pre>
 *   normal mode:  a = μa + σa·z1
 *                 b = μb + σb·(ρ·z1 + √(1−ρ²)·z2)
 *
 *   skew mode:    a = μa + σa·s1
 *                 b = μb + ρ·s1·σb + √(1−ρ²)·σb·s2
 *                 with s1, s2 standardized skew-normal draws
 * </pre>
 * Each side is clamped to {@code sideFloor}. With probability {@code overtimeProbability} an
 * independent extra-points draw {@code max(0, N(overtimeMean, overtimeStd))} is added to the
 * total, split evenly between the sides.
 *
 * <p>Outcome per draw: OVER when the metric is strictly above the line, UNDER when strictly
 * below, PUSH otherwise. Standard errors use the binomial approximation
 * {@code √(p(1−p)/n)}.
 *
 * <p>Stateless; all randomness comes from a {@link Random} seeded from the parameters, so a
 * fixed seed reproduces a run bit for bit.
 */
public final class SimulationKernel {

    static final int[] PERCENTILES = {5, 10, 25, 50, 75, 90, 95};

    private static final double MAX_SKEW_DELTA = 0.99;

    private SimulationKernel() {}

    /**
     * Simulates the combined score of two sides against a total line.
     */
    public static SimulationResult simulateTotal(double meanA, double meanB, double stdA, double stdB,
                                                 double line, SimulationParameters params) {
        Random rng = newRandom(params);
        double[] totals = new double[params.draws()];
        int overtimes = 0;
        double[] pair = new double[2];
        for (int i = 0; i < totals.length; i++) {
            drawPair(meanA, meanB, stdA, stdB, params, rng, pair);
            double total = pair[0] + pair[1];
            double extra = drawOvertime(params, rng);
            if (extra >= 0) {
                overtimes++;
                total += extra;
            }
            totals[i] = total;
        }
        return summarize(totals, line, overtimes, params.seed());
    }

    /**
     * Simulates side A's margin against a handicap. The result's line is {@code -handicapA}, so
     * "over" means side A covers.
     */
    public static SimulationResult simulateSpread(double meanA, double meanB, double stdA, double stdB,
                                                  double handicapA, SimulationParameters params) {
        Random rng = newRandom(params);
        double[] margins = new double[params.draws()];
        int overtimes = 0;
        double[] pair = new double[2];
        for (int i = 0; i < margins.length; i++) {
            drawPair(meanA, meanB, stdA, stdB, params, rng, pair);
            // overtime points are split evenly, so the margin only moves through the floor clamp
            if (drawOvertime(params, rng) >= 0) overtimes++;
            margins[i] = pair[0] - pair[1];
        }
        return summarize(margins, -handicapA, overtimes, params.seed());
    }

    /**
     * Simulates one player's stat line with a minutes-variance model.
     *
     * <pre>
     *   minutes        = min(max(N(μm, σm), 0), maxMinutes), 0 on DNP, ×blowoutFactor on blowout
     *   minutesFactor  = minutes / μm
     *   counting stat  ~ Poisson(projection · minutesFactor [· Gamma(10, 0.1) for streaky stats])
     *   other stat     = max(0, N(projection · minutesFactor, σ · √minutesFactor))
     * </pre>
     * σ is floored at {@code max(σ, 0.15·projection, 1)}. DNP and blowout draws are counted as
     * extreme events.
     */
    public static SimulationResult simulateProp(PropDistribution dist, double line,
                                                SimulationParameters params, PropSimulationParameters prop) {
        Random rng = newRandom(params);
        double projection = dist.mean();
        double std = Math.max(Math.max(dist.stdDev(), projection * 0.15), 1.0);
        String stat = dist.stat() == null ? "" : dist.stat().toLowerCase().replace(' ', '_');
        boolean counting = prop.countingStats().contains(stat);
        boolean streaky  = prop.streakyStats().contains(stat);

        double[] values = new double[params.draws()];
        int extremes = 0;
        for (int i = 0; i < values.length; i++) {
            boolean dnp     = rng.nextDouble() < prop.dnpProbability();
            boolean blowout = rng.nextDouble() < prop.blowoutProbability();
            double minutes = Math.max(dist.minutesMean() + dist.minutesStd() * rng.nextGaussian(), 0.0);
            if (dnp) {
                minutes = 0.0;
            } else if (blowout) {
                minutes *= prop.blowoutMinutesFactor();
            }
            minutes = Math.min(minutes, prop.maxMinutes());
            if (dnp || blowout) extremes++;

            double factor = dist.minutesMean() > 0 ? minutes / dist.minutesMean() : 1.0;
            if (counting) {
                double rate = projection * factor;
                if (streaky) rate *= gamma(10.0, 0.1, rng);
                values[i] = minutes > 0 ? poisson(Math.max(rate, 0.0), rng) : 0.0;
            } else {
                double mean = projection * factor;
                double sd = std * Math.sqrt(factor);
                values[i] = Math.max(0.0, mean + sd * rng.nextGaussian());
            }
        }
        return summarize(values, line, extremes, params.seed());
    }

    // ── Sampling ─────────────────────────────────────────────────────────────

    private static Random newRandom(SimulationParameters params) {
        return params.seed() != null ? new Random(params.seed()) : new Random();
    }

    private static void drawPair(double meanA, double meanB, double stdA, double stdB,
                                 SimulationParameters params, Random rng, double[] out) {
        double sa = Math.max(stdA, params.minStdDev());
        double sb = Math.max(stdB, params.minStdDev());
        double rho = params.correlation();
        double indep = Math.sqrt(1.0 - rho * rho);

        double a;
        double b;
        if (params.skewMode()) {
            double s1 = standardSkewNormal(params.skewness(), rng);
            double s2 = standardSkewNormal(params.skewness(), rng);
            a = meanA + sa * s1;
            b = meanB + rho * s1 * sb + indep * sb * s2;
        } else {
            double z1 = rng.nextGaussian();
            double z2 = rng.nextGaussian();
            a = meanA + sa * z1;
            b = meanB + sb * (rho * z1 + indep * z2);
        }
        out[0] = Math.max(a, params.sideFloor());
        out[1] = Math.max(b, params.sideFloor());
    }

    /** Extra points when overtime happens, or -1 when it does not. */
    private static double drawOvertime(SimulationParameters params, Random rng) {
        if (rng.nextDouble() >= params.overtimeProbability()) return -1.0;
        return Math.max(0.0, params.overtimeMean() + params.overtimeStd() * rng.nextGaussian());
    }

    /**
     * Skew-normal draw rescaled to zero mean and unit variance.
     * <pre>
     *   δ = s/√(1+s²)  (|δ| capped at 0.99)
     *   x = δ·|u0| + √(1−δ²)·u1
     *   (x − δ·√(2/π)) / √(1 − 2δ²/π)
     * </pre>
     */
    static double standardSkewNormal(double skewness, Random rng) {
        double delta = skewness / Math.sqrt(1.0 + skewness * skewness);
        delta = Math.max(-MAX_SKEW_DELTA, Math.min(MAX_SKEW_DELTA, delta));
        double u0 = rng.nextGaussian();
        double u1 = rng.nextGaussian();
        double x = delta * Math.abs(u0) + Math.sqrt(1.0 - delta * delta) * u1;
        double rawMean = delta * Math.sqrt(2.0 / Math.PI);
        double rawVar  = 1.0 - 2.0 * delta * delta / Math.PI;
        return (x - rawMean) / Math.sqrt(rawVar);
    }

    /** Knuth's method for small rates, normal approximation above 30. */
    static int poisson(double lambda, Random rng) {
        if (lambda <= 0) return 0;
        if (lambda > 30) {
            return (int) Math.max(0, Math.round(lambda + Math.sqrt(lambda) * rng.nextGaussian()));
        }
        double limit = Math.exp(-lambda);
        double product = rng.nextDouble();
        int count = 0;
        while (product > limit) {
            product *= rng.nextDouble();
            count++;
        }
        return count;
    }

    /** Marsaglia-Tsang gamma sampler for shape ≥ 1. */
    static double gamma(double shape, double scale, Random rng) {
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x = rng.nextGaussian();
            double v = 1.0 + c * x;
            if (v <= 0) continue;
            v = v * v * v;
            double u = rng.nextDouble();
            if (Math.log(u) < 0.5 * x * x + d - d * v + d * Math.log(v)) {
                return d * v * scale;
            }
        }
    }

    // ── Summary ──────────────────────────────────────────────────────────────

    static SimulationResult summarize(double[] values, double line, int extremeEvents, Long seed) {
        int n = values.length;
        int over = 0;
        int under = 0;
        double sum = 0.0;
        for (double v : values) {
            if (v > line) over++;
            else if (v < line) under++;
            sum += v;
        }
        int push = n - over - under;
        double pOver  = (double) over / n;
        double pUnder = (double) under / n;
        double pPush  = (double) push / n;

        double mean = sum / n;
        double sq = 0.0;
        for (double v : values) sq += (v - mean) * (v - mean);
        double std = Math.sqrt(sq / n);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        Map<Integer, Double> bands = new LinkedHashMap<>();
        for (int q : PERCENTILES) {
            bands.put(q, percentile(sorted, q));
        }

        double seOver  = Math.sqrt(pOver * (1 - pOver) / n);
        double seUnder = Math.sqrt(pUnder * (1 - pUnder) / n);

        return new SimulationResult(
            n, line, pOver, pUnder, pPush, seOver, seUnder,
            SimulationResult.Interval.around(pOver, seOver),
            SimulationResult.Interval.around(pUnder, seUnder),
            mean, percentile(sorted, 50), std, sorted[0], sorted[n - 1],
            bands, extremeEvents, seed);
    }

    /** Linear interpolation between closest ranks. */
    static double percentile(double[] sorted, double q) {
        double rank = q / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
