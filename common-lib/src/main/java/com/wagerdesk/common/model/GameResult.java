package com.wagerdesk.common.model;

import java.util.Map;

/**
 * Realized outcome of an event as reported by the warehouse.
 *
 * @param completed    false while the game is scheduled or in progress
 * @param playerStats  stat values per player entity id, e.g. {@code {"p-23": {"points": 31.0}}}
 */
public record GameResult(
    String eventId,
    boolean completed,
    String sideAId,
    double sideAScore,
    String sideBId,
    double sideBScore,
    Map<String, Map<String, Double>> playerStats
) {
    public GameResult {
        playerStats = playerStats == null ? Map.of() : Map.copyOf(playerStats);
    }

    public double total() {
        return sideAScore + sideBScore;
    }

    /** Margin of the given team, or {@code null} when it did not play in this event. */
    public Double marginFor(String entityId) {
        if (entityId == null) return null;
        if (entityId.equals(sideAId)) return sideAScore - sideBScore;
        if (entityId.equals(sideBId)) return sideBScore - sideAScore;
        return null;
    }

    /** A player's stat, or {@code null} when not recorded. */
    public Double statFor(String entityId, String stat) {
        Map<String, Double> stats = playerStats.get(entityId);
        return stats == null ? null : stats.get(stat);
    }
}
