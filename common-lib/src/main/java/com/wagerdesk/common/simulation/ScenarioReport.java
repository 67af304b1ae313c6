package com.wagerdesk.common.simulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-scenario probabilities plus the range of the under probability across scenarios.
 */
public record ScenarioReport(
    Map<String, Outcome> scenarios,
    double pUnderMin,
    double pUnderMax,
    double pUnderSpread,
    Stability stability
) {
    public ScenarioReport {
        scenarios = scenarios == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scenarios));
    }

    public record Outcome(double pOver, double pUnder, double mean) {}

    public enum Stability {
        STABLE,
        MODERATE,
        HIGH_VARIANCE
    }
}
