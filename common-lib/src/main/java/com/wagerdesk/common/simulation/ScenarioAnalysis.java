package com.wagerdesk.common.simulation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-runs a total simulation under perturbed assumptions to show how sensitive the
 * under probability is to pace, variance, overtime frequency, correlation and skew.
 */
public final class ScenarioAnalysis {

    public static final int DEFAULT_DRAWS = 3_000;

    static final double PACE_SHIFT          = 3.0;
    static final double HIGH_VARIANCE       = 1.3;
    static final double LOW_VARIANCE        = 0.7;
    static final double HIGH_OVERTIME       = 0.10;
    static final double HIGH_CORRELATION    = 0.35;
    static final double UNSTABLE_SPREAD     = 0.15;
    static final double STABLE_SPREAD       = 0.08;

    private ScenarioAnalysis() {}

    public static ScenarioReport run(double meanA, double meanB, double stdA, double stdB,
                                     double line, SimulationParameters base) {
        SimulationParameters p = base.withDraws(Math.min(base.draws(), DEFAULT_DRAWS));
        Map<String, ScenarioReport.Outcome> outcomes = new LinkedHashMap<>();

        put(outcomes, "base",             SimulationKernel.simulateTotal(meanA, meanB, stdA, stdB, line, p));
        put(outcomes, "high_pace",        SimulationKernel.simulateTotal(meanA + PACE_SHIFT, meanB + PACE_SHIFT, stdA, stdB, line, p));
        put(outcomes, "low_pace",         SimulationKernel.simulateTotal(meanA - PACE_SHIFT, meanB - PACE_SHIFT, stdA, stdB, line, p));
        put(outcomes, "high_variance",    SimulationKernel.simulateTotal(meanA, meanB, stdA * HIGH_VARIANCE, stdB * HIGH_VARIANCE, line, p));
        put(outcomes, "low_variance",     SimulationKernel.simulateTotal(meanA, meanB, stdA * LOW_VARIANCE, stdB * LOW_VARIANCE, line, p));
        put(outcomes, "high_overtime",    SimulationKernel.simulateTotal(meanA, meanB, stdA, stdB, line, p.withOvertimeProbability(HIGH_OVERTIME)));
        put(outcomes, "no_correlation",   SimulationKernel.simulateTotal(meanA, meanB, stdA, stdB, line, p.withCorrelation(0.0)));
        put(outcomes, "high_correlation", SimulationKernel.simulateTotal(meanA, meanB, stdA, stdB, line, p.withCorrelation(HIGH_CORRELATION)));
        put(outcomes, "skew_normal",      SimulationKernel.simulateTotal(meanA, meanB, stdA, stdB, line, p.withSkewMode(true)));

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (ScenarioReport.Outcome o : outcomes.values()) {
            min = Math.min(min, o.pUnder());
            max = Math.max(max, o.pUnder());
        }
        double spread = max - min;
        ScenarioReport.Stability stability = spread > UNSTABLE_SPREAD ? ScenarioReport.Stability.HIGH_VARIANCE
                                           : spread < STABLE_SPREAD   ? ScenarioReport.Stability.STABLE
                                           : ScenarioReport.Stability.MODERATE;
        return new ScenarioReport(outcomes, min, max, spread, stability);
    }

    private static void put(Map<String, ScenarioReport.Outcome> outcomes, String name, SimulationResult r) {
        outcomes.put(name, new ScenarioReport.Outcome(r.pOver(), r.pUnder(), r.mean()));
    }
}
