package com.wagerdesk.common.debate;

/**
 * @param topK             arguments kept per side, strongest first
 * @param winnerThreshold  net signal a side must clear to be declared the winner
 */
public record DebateParameters(int topK, double winnerThreshold) {

    public DebateParameters {
        if (topK <= 0) throw new IllegalArgumentException("topK must be positive: " + topK);
        if (winnerThreshold < 0) throw new IllegalArgumentException("winnerThreshold must be >= 0");
    }

    public static DebateParameters defaults() {
        return new DebateParameters(5, 0.1);
    }
}
