package com.wagerdesk.common.simulation;

import java.util.Set;

/**
 * Minutes-variance model for player-prop simulation.
 *
 * @param dnpProbability       chance the player does not play at all
 * @param blowoutProbability   chance of a blowout that cuts the player's minutes
 * @param blowoutMinutesFactor share of minutes kept in a blowout
 * @param maxMinutes           regulation cap on minutes
 * @param countingStats        stats drawn from a Poisson rather than a normal
 * @param streakyStats         counting stats whose rate gets extra gamma noise
 */
public record PropSimulationParameters(
    double dnpProbability,
    double blowoutProbability,
    double blowoutMinutesFactor,
    double maxMinutes,
    Set<String> countingStats,
    Set<String> streakyStats
) {
    public PropSimulationParameters {
        countingStats = countingStats == null ? Set.of() : Set.copyOf(countingStats);
        streakyStats  = streakyStats == null ? Set.of() : Set.copyOf(streakyStats);
    }

    public static PropSimulationParameters defaults() {
        return new PropSimulationParameters(0.02, 0.08, 0.70, 48.0,
            Set.of("3pm", "fg3_made", "steals", "blocks", "turnovers"),
            Set.of("3pm", "fg3_made"));
    }
}
