package com.wagerdesk.common.simulation;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Distribution of a simulated metric against a line.
 *
 * <p>The metric is the combined score for totals, side A's raw margin for spreads (measured
 * against a line of minus side A's handicap, so "over" means side A covers) and the stat value
 * for player props.
 * {@code pOver + pUnder + pPush} is exactly the share of draws in each bucket and sums to 1.
 *
 * @param percentiles   metric value at the 5/10/25/50/75/90/95th percentile, keyed by percentile
 * @param extremeEvents draws with an overtime period (totals and spreads) or a DNP/blowout (props)
 */
public record SimulationResult(
    int draws,
    double line,
    double pOver,
    double pUnder,
    double pPush,
    double seOver,
    double seUnder,
    Interval ci95Over,
    Interval ci95Under,
    double mean,
    double median,
    double stdDev,
    double min,
    double max,
    Map<Integer, Double> percentiles,
    int extremeEvents,
    Long seed
) {
    public SimulationResult {
        percentiles = percentiles == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(percentiles));
    }

    public double extremeEventRate() {
        return draws == 0 ? 0.0 : (double) extremeEvents / draws;
    }

    /** Closed probability interval. */
    public record Interval(double lower, double upper) {

        static Interval around(double p, double se) {
            return new Interval(Math.max(0.0, p - 1.96 * se), Math.min(1.0, p + 1.96 * se));
        }
    }
}
