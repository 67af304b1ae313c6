package com.wagerdesk.common.model;

import java.util.Map;

/**
 * Per-game averages of one player statistic.
 *
 * @param averages            stat average per window; absent windows are missing keys
 * @param stdDev              observed standard deviation; 0 when unknown
 * @param minutesMean         average minutes played
 * @param minutesStd          standard deviation of minutes
 * @param opponentDefFactor   multiplier for the opponent's defense against the player's position (1.0 = neutral)
 */
public record PlayerStatLine(
    String stat,
    Map<Window, Double> averages,
    double stdDev,
    double minutesMean,
    double minutesStd,
    int games,
    double opponentDefFactor
) {
    public PlayerStatLine {
        averages = averages == null ? Map.of() : Map.copyOf(averages);
    }
}
