package com.wagerdesk.common.projection;

import com.wagerdesk.common.model.Window;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Adjustment magnitudes used by {@link ProjectionBuilder}. The rest penalties, bias correction
 * and trend nudges are backtest-tuned and should be revalidated against recent seasons.
 */
public record ProjectionParameters(
    Map<Window, Double> teamWeights,
    Map<Window, Double> propWeights,
    double backToBackPenalty,
    double oneDayRestPenalty,
    double wellRestedBonus,
    int wellRestedDays,
    double fatiguePointValue,
    double headToHeadWeight,
    int headToHeadMinGames,
    double strongTrendRate,
    double mildTrendRate,
    double strongTrendNudge,
    double mildTrendNudge,
    double biasCorrection,
    double defaultStdDev,
    int sampleThreshold,
    double uncertaintyPerGame,
    double homeCourtAdvantage,
    double defaultMinutesStd
) {
    public ProjectionParameters {
        teamWeights = ordered(teamWeights);
        propWeights = ordered(propWeights);
    }

    private static Map<Window, Double> ordered(Map<Window, Double> weights) {
        Map<Window, Double> copy = new EnumMap<>(Window.class);
        if (weights != null) copy.putAll(weights);
        return Collections.unmodifiableMap(copy);
    }

    public static ProjectionParameters defaults() {
        Map<Window, Double> team = new EnumMap<>(Window.class);
        team.put(Window.SEASON, 0.20);
        team.put(Window.L15, 0.25);
        team.put(Window.L10, 0.30);
        team.put(Window.L5, 0.25);
        Map<Window, Double> prop = new EnumMap<>(Window.class);
        prop.put(Window.L5, 0.40);
        prop.put(Window.L10, 0.35);
        prop.put(Window.SEASON, 0.25);
        return new ProjectionParameters(team, prop,
            3.0, 1.5, 2.0, 3,
            0.5,
            0.15, 3,
            0.65, 0.55, 2.0, 1.0,
            12.0,
            12.0, 15, 0.3,
            3.0,
            5.0);
    }
}
